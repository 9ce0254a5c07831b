package im.arun.mathreader.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Every output for one input expression. On a parse failure only
 * {@code input} and {@code error} are set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionResult {

    @JsonProperty("input")
    private String input;

    @JsonProperty("speech")
    private String speech;

    @JsonProperty("braille")
    private BrailleOutput braille;

    @JsonProperty("structure")
    private Map<String, Object> structure;

    @JsonProperty("error")
    private String error;

    public static ConversionResult failure(String input, String error) {
        ConversionResult result = new ConversionResult();
        result.setInput(input);
        result.setError(error);
        return result;
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return error == null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BrailleOutput {
        @JsonProperty("nemeth")
        private String nemeth;

        @JsonProperty("ueb")
        private String ueb;
    }
}

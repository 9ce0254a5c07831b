package im.arun.mathreader.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node in the format-agnostic math tree.
 *
 * <p>A node owns its children. The parent reference is only used for upward
 * queries (depth, path to root, node ids) and is set by {@link #addChild}.
 * A node can belong to one parent at a time.
 *
 * <p>Serialized form: {@code type}, {@code content}, {@code children},
 * {@code metadata}, {@code node_id}, {@code accessibility}.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.NONE,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE,
    setterVisibility = JsonAutoDetect.Visibility.NONE
)
@JsonPropertyOrder({"type", "content", "children", "metadata", "node_id", "accessibility"})
public class SemanticNode {

    public static final String ROOT_ID = "math-node";

    // Metadata keys
    public static final String ROLE = "role";
    public static final String SOURCE = "source";
    public static final String UNKNOWN_COMMAND = "unknown_command";

    // Structural roles
    public static final String ROLE_NUMERATOR = "numerator";
    public static final String ROLE_DENOMINATOR = "denominator";
    public static final String ROLE_BASE = "base";
    public static final String ROLE_EXPONENT = "exponent";
    public static final String ROLE_SUBSCRIPT = "subscript";
    public static final String ROLE_RADICAND = "radicand";
    public static final String ROLE_INDEX = "index";

    private final NodeType nodeType;
    private final String content;
    private final List<SemanticNode> children = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Map<String, Object> accessibilityMetadata = new LinkedHashMap<>();
    private SemanticNode parent;
    private String explicitNodeId;

    public SemanticNode(NodeType nodeType) {
        this(nodeType, "");
    }

    public SemanticNode(NodeType nodeType, String content) {
        this.nodeType = Objects.requireNonNull(nodeType, "nodeType");
        this.content = content != null ? content : "";
    }

    public SemanticNode(NodeType nodeType, String content, Map<String, ?> metadata) {
        this(nodeType, content);
        if (metadata != null) {
            this.metadata.putAll(metadata);
        }
    }

    /**
     * Group wrapper tagged with a structural role (numerator, base, ...).
     */
    public static SemanticNode roleGroup(String role) {
        return new SemanticNode(NodeType.GROUP, "", Map.of(ROLE, role));
    }

    @JsonCreator
    static SemanticNode fromJson(
            @JsonProperty("type") NodeType type,
            @JsonProperty("content") String content,
            @JsonProperty("children") List<SemanticNode> children,
            @JsonProperty("metadata") Map<String, Object> metadata,
            @JsonProperty("node_id") String nodeId,
            @JsonProperty("accessibility") Map<String, Object> accessibility) {
        if (type == null) {
            throw new IllegalArgumentException("Serialized node is missing 'type'");
        }
        SemanticNode node = new SemanticNode(type, content, metadata);
        if (children != null) {
            children.forEach(node::addChild);
        }
        if (nodeId != null) {
            node.explicitNodeId = nodeId;
        }
        if (accessibility != null) {
            node.accessibilityMetadata.putAll(accessibility);
        }
        return node;
    }

    /**
     * Appends a child and points its parent reference here.
     *
     * @throws IllegalStateException if the child already belongs to a parent
     */
    public SemanticNode addChild(SemanticNode child) {
        Objects.requireNonNull(child, "child");
        if (child.parent != null) {
            throw new IllegalStateException("Node " + child + " already has a parent");
        }
        if (child == this) {
            throw new IllegalStateException("A node cannot be its own child");
        }
        child.parent = this;
        children.add(child);
        return this;
    }

    /**
     * Detaches and returns the last child, or {@code null} when there is none.
     */
    public SemanticNode removeLastChild() {
        if (children.isEmpty()) {
            return null;
        }
        SemanticNode last = children.remove(children.size() - 1);
        last.parent = null;
        return last;
    }

    public <R> R accept(NodeVisitor<R> visitor) {
        return nodeType.accept(visitor, this);
    }

    @JsonProperty("type")
    public NodeType getNodeType() {
        return nodeType;
    }

    @JsonProperty("content")
    public String getContent() {
        return content;
    }

    @JsonProperty("children")
    public List<SemanticNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @JsonProperty("accessibility")
    public Map<String, Object> getAccessibilityMetadata() {
        return accessibilityMetadata;
    }

    /**
     * Path-based id: the root is {@value #ROOT_ID} and every child extends
     * its parent's id with its ordinal. An explicitly restored id wins.
     */
    @JsonProperty("node_id")
    public String getNodeId() {
        if (explicitNodeId != null) {
            return explicitNodeId;
        }
        if (parent == null) {
            return ROOT_ID;
        }
        return parent.getNodeId() + "-" + parent.indexOfChild(this);
    }

    public void setNodeId(String nodeId) {
        this.explicitNodeId = nodeId;
    }

    public SemanticNode getParent() {
        return parent;
    }

    public SemanticNode getChild(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public String getRole() {
        Object role = metadata.get(ROLE);
        return role != null ? role.toString() : null;
    }

    /**
     * Number of edges to the root; 0 for the root itself.
     */
    public int getDepth() {
        int depth = 0;
        SemanticNode node = this;
        while (node.parent != null) {
            depth++;
            node = node.parent;
        }
        return depth;
    }

    /**
     * Pre-order traversal of this subtree, this node first.
     */
    public List<SemanticNode> walk() {
        List<SemanticNode> nodes = new ArrayList<>();
        collect(this, nodes);
        return nodes;
    }

    private static void collect(SemanticNode node, List<SemanticNode> into) {
        into.add(node);
        for (SemanticNode child : node.children) {
            collect(child, into);
        }
    }

    public List<SemanticNode> walkLeaves() {
        List<SemanticNode> leaves = new ArrayList<>();
        for (SemanticNode node : walk()) {
            if (node.isLeaf()) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    /**
     * Children with Group and Root nodes spliced out recursively, so that
     * navigation never stops on a node that only exists for grouping.
     */
    public List<SemanticNode> getNavigableChildren() {
        List<SemanticNode> navigable = new ArrayList<>();
        for (SemanticNode child : children) {
            if (child.nodeType.isGrouping()) {
                navigable.addAll(child.getNavigableChildren());
            } else {
                navigable.add(child);
            }
        }
        return navigable;
    }

    /**
     * Nodes from the root down to this node, inclusive.
     */
    public List<SemanticNode> getPathFromRoot() {
        List<SemanticNode> path = new ArrayList<>();
        SemanticNode node = this;
        while (node != null) {
            path.add(node);
            node = node.parent;
        }
        Collections.reverse(path);
        return path;
    }

    public SemanticNode getRoot() {
        SemanticNode node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node;
    }

    /**
     * Writes the non-null values into the accessibility metadata.
     */
    public void setAccessibilityMetadata(String spokenText, String ariaRole, String ariaLabel,
                                         String description, String navigationHint,
                                         String ariaRoledescription) {
        putIfPresent("spoken_text", spokenText);
        putIfPresent("aria_role", ariaRole);
        putIfPresent("aria_label", ariaLabel);
        putIfPresent("description", description);
        putIfPresent("navigation_hint", navigationHint);
        putIfPresent("aria_roledescription", ariaRoledescription);
    }

    private void putIfPresent(String key, String value) {
        if (value != null) {
            accessibilityMetadata.put(key, value);
        }
    }

    // Identity lookup: structurally equal siblings must not share an id.
    private int indexOfChild(SemanticNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(nodeType.name());
        if (!content.isEmpty()) {
            sb.append("(\"").append(content).append("\")");
        }
        if (!children.isEmpty()) {
            sb.append('[').append(children.size()).append(" children]");
        }
        return sb.toString();
    }
}

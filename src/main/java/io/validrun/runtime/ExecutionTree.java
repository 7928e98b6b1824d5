package io.validrun.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.model.CaseManifest;
import io.validrun.model.Identity;
import io.validrun.model.PlanManifest;
import io.validrun.model.Privilege;
import io.validrun.model.SuiteControls;
import io.validrun.model.SuiteManifest;
import io.validrun.resolve.ResolvedInputs;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Flat arena of plan, suite and case nodes. Nodes reference each other by index; a child is
 * always added after its parent, so a reverse scan visits children before parents.
 */
public final class ExecutionTree {
    public static final int NO_PARENT = -1;

    public enum Kind {
        PLAN,
        SUITE,
        CASE
    }

    private final List<Node> nodes = new ArrayList<>();

    public int addPlan(Identity identity, PlanManifest manifest, Path manifestPath, SuiteControls controls,
                       Map<String, String> environment) {
        Node node = new Node(nodes.size(), NO_PARENT, Kind.PLAN, null, identity, Privilege.USER, manifestPath);
        node.plan = manifest;
        node.controls = controls;
        node.environment = environment;
        return add(node);
    }

    public int addSuite(int parent, String nodeId, Identity identity, SuiteManifest manifest, Path manifestPath,
                        SuiteControls controls, Map<String, String> environment) {
        Node node = new Node(nodes.size(), parent, Kind.SUITE, nodeId, identity, Privilege.USER, manifestPath);
        node.suite = manifest;
        node.controls = controls;
        node.environment = environment;
        return add(node);
    }

    public int addCase(int parent, String nodeId, CaseManifest manifest, Path caseFolder, Path manifestPath,
                       String ref, ResolvedInputs inputs, Map<String, String> environment) {
        Node node = new Node(nodes.size(), parent, Kind.CASE, nodeId, manifest.identity(), manifest.privilege(), manifestPath);
        node.caseManifest = manifest;
        node.caseFolder = caseFolder;
        node.ref = ref;
        node.inputs = inputs;
        node.environment = environment;
        return add(node);
    }

    private int add(Node node) {
        nodes.add(node);
        if (node.parent != NO_PARENT) {
            nodes.get(node.parent).children.add(node.index);
        }
        return node.index;
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    public Node root() {
        return nodes.get(0);
    }

    public int size() {
        return nodes.size();
    }

    public List<Node> children(int index) {
        List<Node> out = new ArrayList<>();
        for (int child : nodes.get(index).children) {
            out.add(nodes.get(child));
        }
        return out;
    }

    /**
     * Bottom-up roll-up: every node ends with the max privilege of itself and its descendants.
     */
    public void computeEffectivePrivileges() {
        for (Node node : nodes) {
            node.effectivePrivilege = node.ownPrivilege;
        }
        for (int i = nodes.size() - 1; i >= 0; i--) {
            Node node = nodes.get(i);
            if (node.parent != NO_PARENT) {
                Node parent = nodes.get(node.parent);
                parent.effectivePrivilege = Privilege.max(parent.effectivePrivilege, node.effectivePrivilege);
            }
        }
    }

    public static final class Node {
        private final int index;
        private final int parent;
        private final Kind kind;
        private final String nodeId;
        private final Identity identity;
        private final Privilege ownPrivilege;
        private final Path manifestPath;
        private final List<Integer> children = new ArrayList<>();
        private Privilege effectivePrivilege;
        private PlanManifest plan;
        private SuiteManifest suite;
        private SuiteControls controls;
        private CaseManifest caseManifest;
        private Path caseFolder;
        private String ref;
        private ResolvedInputs inputs;
        private Map<String, String> environment = Map.of();

        private Node(int index, int parent, Kind kind, String nodeId, Identity identity, Privilege ownPrivilege,
                     Path manifestPath) {
            this.index = index;
            this.parent = parent;
            this.kind = kind;
            this.nodeId = nodeId;
            this.identity = identity;
            this.ownPrivilege = ownPrivilege;
            this.effectivePrivilege = ownPrivilege;
            this.manifestPath = manifestPath;
        }

        public int index() {
            return index;
        }

        public int parent() {
            return parent;
        }

        public Kind kind() {
            return kind;
        }

        public String nodeId() {
            return nodeId;
        }

        public Identity identity() {
            return identity;
        }

        public Privilege ownPrivilege() {
            return ownPrivilege;
        }

        public Privilege effectivePrivilege() {
            return effectivePrivilege;
        }

        public Path manifestPath() {
            return manifestPath;
        }

        public List<Integer> childIndices() {
            return Collections.unmodifiableList(children);
        }

        public PlanManifest plan() {
            return plan;
        }

        public SuiteManifest suite() {
            return suite;
        }

        public SuiteControls controls() {
            return controls;
        }

        public CaseManifest caseManifest() {
            return caseManifest;
        }

        public Path caseFolder() {
            return caseFolder;
        }

        public String ref() {
            return ref;
        }

        public ResolvedInputs inputs() {
            return inputs;
        }

        /**
         * Variables layered over the OS environment for this node.
         */
        public Map<String, String> environment() {
            return environment;
        }

        public String workingDir() {
            return suite != null ? suite.environment().workingDir() : null;
        }
    }
}

package resqpack.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import resqpack.core.identity.Oid;

/**
 * Undirected view of the reference graph: one node per object and one edge
 * per pair of objects where either references the other.
 */
public final class ObjectGraph {
    private final Map<Oid, Node> nodes;
    private final Set<Edge> edges;

    ObjectGraph(Map<Oid, Node> nodes, Set<Edge> edges) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableSet(new LinkedHashSet<>(edges));
    }

    public Map<Oid, Node> getNodes() {
        return nodes;
    }

    public Set<Edge> getEdges() {
        return edges;
    }

    public boolean connected(Oid a, Oid b) {
        return edges.contains(new Edge(a, b));
    }

    /**
     * Neighbours of {@code oid} within the graph.
     */
    public Set<Oid> neighbours(Oid oid) {
        Set<Oid> result = new LinkedHashSet<>();
        for (Edge edge : edges) {
            if (edge.getFirst().equals(oid)) {
                result.add(edge.getSecond());
            } else if (edge.getSecond().equals(oid)) {
                result.add(edge.getFirst());
            }
        }
        return result;
    }

    public static final class Node {
        private final Oid oid;
        private final String type;
        private final String title;

        Node(Oid oid, String type, String title) {
            this.oid = oid;
            this.type = type;
            this.title = title;
        }

        public Oid getOid() {
            return oid;
        }

        public String getType() {
            return type;
        }

        public String getTitle() {
            return title;
        }

        @Override
        public String toString() {
            return type + " '" + title + "' " + oid;
        }
    }

    /**
     * Unordered pair of OIDs; the smaller OID is always first.
     */
    public static final class Edge {
        private final Oid first;
        private final Oid second;

        public Edge(Oid a, Oid b) {
            if (a.compareTo(b) <= 0) {
                this.first = a;
                this.second = b;
            } else {
                this.first = b;
                this.second = a;
            }
        }

        public Oid getFirst() {
            return first;
        }

        public Oid getSecond() {
            return second;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (obj == null || getClass() != obj.getClass())
                return false;
            Edge other = (Edge) obj;
            return first.equals(other.first) && second.equals(other.second);
        }

        @Override
        public int hashCode() {
            return Objects.hash(first, second);
        }

        @Override
        public String toString() {
            return first + " -- " + second;
        }
    }
}

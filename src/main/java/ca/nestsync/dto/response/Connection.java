package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Relay-style connection shared by the child, inventory and usage log listings.
 *
 * @param <T> node type
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Connection<T> {

    private List<Edge<T>> edges = new ArrayList<>();
    private PageInfo pageInfo;

    /**
     * Build a connection from one page of nodes.
     *
     * @param nodes nodes of the page, already trimmed to the page size
     * @param cursorOf cursor for a node
     * @param hasNextPage whether more nodes follow
     * @param hasPreviousPage whether nodes precede this page
     * @param totalCount total matching nodes, or null
     */
    public static <T> Connection<T> of(List<T> nodes,
                                       Function<T, String> cursorOf,
                                       boolean hasNextPage,
                                       boolean hasPreviousPage,
                                       Integer totalCount) {
        List<Edge<T>> edges = new ArrayList<>(nodes.size());
        for (T node : nodes) {
            edges.add(new Edge<>(node, cursorOf.apply(node)));
        }
        PageInfo pageInfo = PageInfo.builder()
                .hasNextPage(hasNextPage)
                .hasPreviousPage(hasPreviousPage)
                .startCursor(edges.isEmpty() ? null : edges.get(0).getCursor())
                .endCursor(edges.isEmpty() ? null : edges.get(edges.size() - 1).getCursor())
                .totalCount(totalCount)
                .build();
        return new Connection<>(edges, pageInfo);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Edge<T> {
        private T node;
        private String cursor;
    }
}

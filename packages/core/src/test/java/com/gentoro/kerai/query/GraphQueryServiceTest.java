package com.gentoro.kerai.query;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kerai.KeraiFixture;
import com.gentoro.kerai.crdt.OperationDraft;
import com.gentoro.kerai.exception.NotFoundException;
import com.gentoro.kerai.exception.ValidationException;
import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKinds;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKinds;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GraphQueryServiceTest {
  private static final String PATH = "src/geo.rs";
  private static final String SOURCE =
      String.join(
          "\n",
          "pub struct Point {",
          "    x: i32,",
          "}",
          "",
          "const ORIGIN: i32 = 0;",
          "",
          "fn make_point() -> Point {",
          "    Point { x: ORIGIN }",
          "}",
          "",
          "fn origin() -> Point {",
          "    make_point()",
          "}",
          "",
          "impl Point {",
          "    fn norm(&self) -> i32 {",
          "        self.x",
          "    }",
          "}",
          "");

  private KeraiFixture k;
  private GraphQueryService query;

  @BeforeEach
  void setUp() {
    k = KeraiFixture.plain();
    k.ingest.ingest(PATH, SOURCE);
    query = k.query;
  }

  private static List<String> names(List<Node> nodes) {
    return nodes.stream().map(n -> n.metaString("name")).collect(Collectors.toList());
  }

  @Test
  void findMatchesLikePatternsOrderedByNameThenKind() {
    List<Node> found = query.find("%point%", null, null);
    assertEquals(List.of("Point", "Point", "make_point"), names(found));
    assertEquals(
        List.of(NodeKinds.IMPL, NodeKinds.STRUCT, NodeKinds.FUNCTION),
        found.stream().map(Node::getKind).collect(Collectors.toList()));

    assertEquals(List.of("make_point"), names(query.find("%point%", NodeKinds.FUNCTION, null)));
    assertEquals(List.of("norm"), names(query.find("n_rm", null, null)));
    assertEquals(1, query.find("src/geo.rs", NodeKinds.FILE, null).size());
  }

  @Test
  void findClampsLimitAndRejectsEmptyPatterns() {
    assertEquals(2, query.find("%", null, 2).size());
    assertEquals(1, query.find("%", null, 0).size());
    assertThrows(ValidationException.class, () -> query.find("", null, null));
  }

  @Test
  void likePatternQuotesEverythingElse() {
    assertTrue(GraphQueryService.likePattern("a_c%").matcher("ABCdef").matches());
    assertFalse(GraphQueryService.likePattern("a.c").matcher("abc").matches());
    assertTrue(GraphQueryService.likePattern("a.c").matcher("a.c").matches());
  }

  @Test
  void navigatesChildrenAndAncestors() {
    Node impl = query.find("Point", NodeKinds.IMPL, null).get(0);
    Node norm = k.named(NodeKinds.FUNCTION, "norm");

    assertEquals(List.of(norm), query.children(impl.getId()));
    assertEquals(
        List.of(impl.getId(), KeraiFixture.rootId(PATH)),
        query.ancestors(norm.getId()).stream().map(Node::getId).collect(Collectors.toList()));
    assertTrue(query.ancestors(KeraiFixture.rootId(PATH)).isEmpty());
    assertThrows(NotFoundException.class, () -> query.children("missing"));
  }

  @Test
  void refsListDefinitionsAndReferrers() {
    GraphQueryService.Refs refs = query.refs("make_point");
    assertEquals(List.of("make_point"), names(refs.definitions()));
    assertEquals(List.of("origin"), names(refs.references()));

    assertEquals(List.of("make_point"), names(query.refs("ORIGIN").references()));

    GraphQueryService.Refs point = query.refs("Point");
    assertEquals(2, point.definitions().size());
    assertTrue(names(point.references()).containsAll(List.of("make_point", "origin")));
    assertThrows(ValidationException.class, () -> query.refs(" "));
  }

  @Test
  void deletedTargetLeavesADanglingEdge() {
    assertTrue(query.danglingEdges(null).isEmpty());
    Node makePoint = k.named(NodeKinds.FUNCTION, "make_point");
    Node origin = k.named(NodeKinds.FUNCTION, "origin");

    k.log.submit(List.of(OperationDraft.delete(makePoint.getId())));

    List<Edge> dangling = query.danglingEdges(KeraiFixture.rootId(PATH));
    assertEquals(
        List.of(new Edge(EdgeKinds.REFERENCES, origin.getId(), makePoint.getId())), dangling);
    assertEquals(dangling, query.danglingEdges(null));
  }

  @Test
  void statusCountsTheStore() {
    GraphQueryService.Status status = query.status();
    assertEquals(1, status.files());
    assertEquals(k.store.readAllNodes().size(), status.nodes());
    assertEquals(k.store.operationCount(), status.operations());
    assertEquals(Map.of("local", (long) k.store.operationCount()), status.versionVector());
  }
}

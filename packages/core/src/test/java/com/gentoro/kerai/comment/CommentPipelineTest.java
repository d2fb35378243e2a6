package com.gentoro.kerai.comment;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kerai.extract.ExtractionResult;
import com.gentoro.kerai.extract.StructuralExtractor;
import com.gentoro.kerai.grammar.SyntaxTree;
import com.gentoro.kerai.grammar.brace.BraceGrammarParser;
import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKinds;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.normalize.TextNormalizer;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommentPipelineTest {

  private static ExtractionResult extract(String text) {
    String normalized = TextNormalizer.normalize(text);
    SyntaxTree tree = new BraceGrammarParser().parse("lib.rs", normalized);
    ExtractionResult result = new StructuralExtractor().extract("lib.rs", normalized, tree);
    new CommentPipeline().apply(result, tree.stringSpans());
    return result;
  }

  private static List<Node> comments(ExtractionResult r) {
    return r.nodes().stream()
        .filter(n -> NodeKinds.COMMENT_BLOCK.equals(n.getKind()))
        .collect(Collectors.toList());
  }

  private static List<Edge> documents(ExtractionResult r) {
    return r.edges().stream()
        .filter(e -> EdgeKinds.DOCUMENTS.equals(e.getKind()))
        .collect(Collectors.toList());
  }

  private static Node unit(ExtractionResult r, String name) {
    return r.nodes().stream()
        .filter(n -> name.equals(n.metaString(MetaKeys.NAME)))
        .findFirst()
        .orElseThrow();
  }

  @Test
  @DisplayName("three consecutive line comments above a declaration form one block placed above")
  void groupsConsecutiveLineComments() {
    ExtractionResult r = extract("/// One.\n/// Two.\n/// Three.\npub fn f() {}\n");

    List<Node> comments = comments(r);
    assertEquals(1, comments.size());
    Node block = comments.get(0);
    assertEquals("above", block.metaString(MetaKeys.PLACEMENT));
    assertEquals("/// One.\n/// Two.\n/// Three.", block.getContent());
    assertTrue(block.metaBoolean(MetaKeys.DOC));
    assertEquals(r.rootId(), block.getParentId());

    List<Edge> docs = documents(r);
    assertEquals(1, docs.size());
    assertEquals(block.getId(), docs.get(0).getSourceId());
    assertEquals(unit(r, "f").getId(), docs.get(0).getTargetId());
  }

  @Test
  @DisplayName("a string literal that looks like a comment produces no comment node")
  void ignoresCommentMarkersInStrings() {
    ExtractionResult r = extract("const S: &str = \"// not a comment\";\n");
    assertTrue(comments(r).isEmpty());
  }

  @Test
  void ignoresLinesInsideMultiLineStrings() {
    ExtractionResult r = extract("const S: &str = \"first\n// inside\nlast\";\nfn g() {}\n");
    assertTrue(comments(r).isEmpty());
  }

  @Test
  @DisplayName("a comment after code on a unit's last line is trailing and cut from the unit")
  void detachesTrailingComment() {
    ExtractionResult r = extract("const MAX: u32 = 10;  // limit\n");

    Node max = unit(r, "MAX");
    assertEquals("const MAX: u32 = 10;", max.getContent());

    List<Node> comments = comments(r);
    assertEquals(1, comments.size());
    Node trailing = comments.get(0);
    assertEquals("trailing", trailing.metaString(MetaKeys.PLACEMENT));
    assertEquals("// limit", trailing.getContent());
    assertEquals("  ", trailing.metaString(MetaKeys.GAP));

    Edge edge = documents(r).get(0);
    assertEquals(max.getId(), edge.getTargetId());
    assertEquals("trailing", edge.getMetadata().get(MetaKeys.PLACEMENT));
  }

  @Test
  void commentsInsideABodyStayInTheUnit() {
    ExtractionResult r = extract("fn f() {\n    // inside\n    g();\n}\n");
    assertTrue(comments(r).isEmpty());
    assertTrue(unit(r, "f").getContent().contains("// inside"));
  }

  @Test
  @DisplayName("blank line after a comment between two items makes it 'between' the next one")
  void classifiesBetween() {
    ExtractionResult r = extract("fn a() {}\n// loose\n\nfn b() {}\n");
    Node comment = comments(r).get(0);
    assertEquals("between", comment.metaString(MetaKeys.PLACEMENT));
    assertEquals(unit(r, "b").getId(), documents(r).get(0).getTargetId());
  }

  @Test
  @DisplayName("a comment with nothing after it is eof and documents nothing")
  void classifiesEof() {
    ExtractionResult r = extract("fn a() {}\n\n// tail\n");
    Node comment = comments(r).get(0);
    assertEquals("eof", comment.metaString(MetaKeys.PLACEMENT));
    assertTrue(documents(r).isEmpty());
  }

  @Test
  @DisplayName("no previous node and a blank line before the next falls back to eof")
  void ambiguousPlacementFallsBackToEof() {
    ExtractionResult r = extract("//! Crate docs.\n\nfn a() {}\n");
    Node comment = comments(r).get(0);
    assertEquals("eof", comment.metaString(MetaKeys.PLACEMENT));
    assertTrue(comment.metaBoolean(MetaKeys.INNER));
    assertTrue(documents(r).isEmpty());
  }

  @Test
  @DisplayName("comments in a container body are parented to the container")
  void commentsInsideContainers() {
    ExtractionResult r =
        extract("impl P {\n    /// Makes one.\n    pub fn new() -> P {\n        P\n    }\n}\n");
    Node impl = unit(r, "P");
    Node comment = comments(r).get(0);
    assertEquals(impl.getId(), comment.getParentId());
    assertEquals("    /// Makes one.", comment.getContent());
    assertEquals(unit(r, "new").getId(), documents(r).get(0).getTargetId());
  }
}

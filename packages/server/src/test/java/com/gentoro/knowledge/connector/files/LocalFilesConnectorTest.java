package com.gentoro.knowledge.connector.files;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.connector.ConnectorContext;
import com.gentoro.knowledge.connector.ObserveResult;
import com.gentoro.knowledge.connector.ResolveResult;
import com.gentoro.knowledge.exception.NotFoundException;
import com.gentoro.knowledge.model.BundleCollection;
import com.gentoro.knowledge.model.BundleFile;
import com.gentoro.knowledge.model.BundlePlain;
import com.gentoro.knowledge.model.Fragment;
import com.gentoro.knowledge.model.FragmentMode;
import com.gentoro.knowledge.model.Locator;
import com.gentoro.knowledge.model.MetadataDelta;
import com.gentoro.knowledge.uri.Affordance;
import com.gentoro.knowledge.uri.ExternalUri;
import com.gentoro.knowledge.uri.KnowledgeUri;
import com.gentoro.knowledge.uri.Observable;
import com.gentoro.knowledge.uri.ResourceUri;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("LocalFilesConnector")
class LocalFilesConnectorTest {

  @TempDir Path root;

  private LocalFilesConnector connector;
  private ConnectorContext context;

  @BeforeEach
  void setUp() throws Exception {
    Files.createDirectories(root.resolve("img"));
    Files.writeString(root.resolve("guide.md"), "# Guide\n\n![Diagram](img/diagram.png)\n");
    Files.write(root.resolve("img/diagram.png"), new byte[] {(byte) 0x89, 'P', 'N', 'G'});
    Files.writeString(root.resolve("notes.txt"), "plain notes");
    Files.write(root.resolve("report.pdf"), new byte[] {'%', 'P', 'D', 'F'});
    Files.writeString(root.resolve(".hidden"), "x");
    connector = new LocalFilesConnector("files", "docs", root);
    context = new ConnectorContext(Map.of(), name -> null);
  }

  private Locator locate(String uri) {
    return connector.locate(KnowledgeUri.parse(uri), context);
  }

  @Test
  @DisplayName("Only URIs of its realm and volume are claimed")
  void locatesOwnUris() {
    Locator locator = locate("ndk://files/docs/guide.md/$body");

    assertEquals(new LocalFileLocator("files", "docs", List.of("guide.md")), locator);
    assertNull(locate("ndk://files/other/guide.md"));
    assertNull(locate("ndk://jira/PROJ/PROJ-1"));
    assertNull(connector.locate(ExternalUri.parse("https://example.com/guide.md"), context));
    assertThrows(NotFoundException.class, () -> locate("ndk://files/docs/missing.md"));
  }

  @Test
  @DisplayName("Markdown files expose body and plain, other files expose file")
  void resolvesAffordances() {
    ResolveResult markdown = connector.resolve(locate("ndk://files/docs/guide.md"), null, context);
    ResolveResult pdf = connector.resolve(locate("ndk://files/docs/report.pdf"), null, context);
    ResolveResult dir = connector.resolve(locate("ndk://files/docs/img"), null, context);

    assertEquals(List.of(Affordance.BODY, Affordance.PLAIN), markdown.metadata().affordances());
    assertEquals("text/markdown", markdown.metadata().mimeType());
    assertTrue(markdown.metadata().revisionData().startsWith("file-"));
    assertEquals(List.of(Affordance.FILE), pdf.metadata().affordances());
    assertEquals(List.of(Affordance.COLLECTION), dir.metadata().affordances());
    assertEquals("inode/directory", dir.metadata().mimeType());
  }

  @Test
  @DisplayName("Markdown bodies carry the images they reference as blobs")
  void observesMarkdownWithImages() {
    ObserveResult result =
        connector.observe(
            locate("ndk://files/docs/guide.md"),
            Observable.of(Affordance.BODY),
            MetadataDelta.EMPTY,
            context);

    Fragment fragment = assertInstanceOf(Fragment.class, result.content());
    assertEquals(FragmentMode.MARKDOWN, fragment.mode());
    assertEquals("image/png", fragment.blobs().get("img/diagram.png").mimeType());
    assertTrue(result.options().relationsLink());
  }

  @Test
  @DisplayName("Text files are plain fragments and their raw text is a $plain bundle")
  void observesText() {
    Locator notes = locate("ndk://files/docs/notes.txt");

    ObserveResult body =
        connector.observe(notes, Observable.of(Affordance.BODY), MetadataDelta.EMPTY, context);
    ObserveResult plain =
        connector.observe(notes, Observable.of(Affordance.PLAIN), MetadataDelta.EMPTY, context);

    assertEquals(FragmentMode.PLAIN, ((Fragment) body.content()).mode());
    assertEquals("plain notes", assertInstanceOf(BundlePlain.class, plain.content()).text());
  }

  @Test
  @DisplayName("Directories list visible children as a collection")
  void observesDirectory() {
    ObserveResult result =
        connector.observe(
            locate("ndk://files/docs/img"),
            Observable.of(Affordance.COLLECTION),
            MetadataDelta.EMPTY,
            context);

    BundleCollection collection = assertInstanceOf(BundleCollection.class, result.content());
    assertEquals(List.of(ResourceUri.of("files", "docs", "img", "diagram.png")), collection.results());
    assertTrue(result.options().relationsParent());
  }

  @Test
  @DisplayName("Binary files are offered for download")
  void observesFile() {
    ObserveResult result =
        connector.observe(
            locate("ndk://files/docs/report.pdf"),
            Observable.of(Affordance.FILE),
            MetadataDelta.EMPTY,
            context);

    BundleFile file = assertInstanceOf(BundleFile.class, result.content());
    assertEquals("application/pdf", file.mimeType());
    assertEquals(4L, file.size());
    assertTrue(file.downloadUrl().startsWith("file:"));
  }
}

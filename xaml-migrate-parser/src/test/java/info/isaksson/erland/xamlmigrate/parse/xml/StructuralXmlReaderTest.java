package info.isaksson.erland.xamlmigrate.parse.xml;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StructuralXmlReaderTest {

    private static final String SAMPLE = "<?xml version=\"1.0\"?>\n"
            + "<Window xmlns=\"urn:a\" xmlns:x=\"urn:x\" x:Name=\"w\" Title=\"T\">\n"
            + "  <!-- c -->\n"
            + "  <Button Content=\"x\"/>\n"
            + "  <TextBlock>Hello &amp; bye</TextBlock>\n"
            + "</Window>\n";

    @Test
    void recordsDeclarationCommentsAndElementOffsets() throws Exception {
        XmlDocumentNode doc = new StructuralXmlReader().read(SAMPLE);

        assertEquals("<?xml version=\"1.0\"?>", doc.getDeclarationText());
        assertEquals("1.0", doc.getVersion());

        XmlElementNode window = doc.getRoot();
        assertEquals("Window", window.getLocalName());
        assertEquals("urn:a", window.getNamespaceUri());
        assertEquals(2, window.getLine());
        assertEquals(2, window.getColumn());
        assertEquals(SAMPLE.indexOf("<Window"), window.getStartOffset());
        assertEquals(SAMPLE.indexOf("</Window>"), window.getEndTagStart());
        assertEquals(SAMPLE.indexOf("</Window>") + "</Window>".length(), window.getEndOffset());

        List<XmlElementNode> children = window.childElements();
        assertEquals(2, children.size());
        XmlElementNode button = children.get(0);
        assertTrue(button.isSelfClosing());
        assertEquals(4, button.getLine());
        assertEquals(4, button.getColumn());
        assertEquals(SAMPLE.indexOf("<Button"), button.getStartOffset());

        XmlCommentNode comment = null;
        for (XmlNode n : window.getContent()) {
            if (n instanceof XmlCommentNode) comment = (XmlCommentNode) n;
        }
        assertNotNull(comment);
        assertEquals(" c ", comment.getText());
        assertEquals(3, comment.getLine());
        assertEquals(SAMPLE.indexOf("<!--"), comment.getStartOffset());

        XmlElementNode text = children.get(1);
        XmlTextNode content = (XmlTextNode) text.getContent().get(0);
        assertEquals("Hello & bye", content.getText());
        assertEquals(SAMPLE.indexOf("</TextBlock>"), text.getEndTagStart());
    }

    @Test
    void attributesKeepSourceOrderAndNamespaceDeclarationsAreMarked() throws Exception {
        XmlElementNode window = new StructuralXmlReader().read(SAMPLE).getRoot();
        List<XmlAttributeNode> attrs = window.getAttributes();

        assertEquals(4, attrs.size());
        assertEquals("xmlns", attrs.get(0).getQualifiedName());
        assertTrue(attrs.get(0).isNamespaceDeclaration());
        assertEquals("", attrs.get(0).declaredPrefix());
        assertEquals("xmlns:x", attrs.get(1).getQualifiedName());
        assertEquals("x", attrs.get(1).declaredPrefix());
        assertEquals("x:Name", attrs.get(2).getQualifiedName());
        assertEquals("urn:x", attrs.get(2).getNamespaceUri());
        assertEquals("Title", attrs.get(3).getQualifiedName());
        assertEquals(SAMPLE.indexOf("Title"), attrs.get(3).getSourceOffset());
    }

    @Test
    void propertyElementsAreRecognizedByDottedName() throws Exception {
        XmlElementNode grid = new StructuralXmlReader()
                .read("<Grid><Grid.RowDefinitions><RowDefinition/></Grid.RowDefinitions><Button/></Grid>")
                .getRoot();
        assertTrue(grid.childElements().get(0).isPropertyElement());
        assertFalse(grid.childElements().get(1).isPropertyElement());
    }

    @Test
    void prologAndEpilogCommentsAreKeptOnTheDocument() throws Exception {
        XmlDocumentNode doc = new StructuralXmlReader().read("<!-- a --><Root/><!-- b -->");
        assertEquals(1, doc.getPrologComments().size());
        assertEquals(" a ", doc.getPrologComments().get(0).getText());
        assertEquals(1, doc.getEpilogComments().size());
        assertEquals(" b ", doc.getEpilogComments().get(0).getText());
    }

    @Test
    void mismatchedTagIsReportedWithLocation() {
        XmlSyntaxException ex = assertThrows(XmlSyntaxException.class,
                () -> new StructuralXmlReader().read("<Window>\n  <Button>\n</Window>"));
        assertTrue(ex.hasLocation());
        assertTrue(ex.getLine() >= 2, "line " + ex.getLine());
        assertTrue(ex.getColumn() > 0);
    }

    @Test
    void unterminatedStartTagIsRejected() {
        XmlSyntaxException ex = assertThrows(XmlSyntaxException.class,
                () -> new StructuralXmlReader().read("<Window>\n  <Button Content=\"x\"\n"));
        assertNotNull(ex.getMessage());
    }

    @Test
    void documentWithoutRootIsRejected() {
        assertThrows(XmlSyntaxException.class, () -> new StructuralXmlReader().read("<!-- only a comment -->"));
    }
}

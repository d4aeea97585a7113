package info.isaksson.erland.xamlmigrate.ast.markup;

import info.isaksson.erland.xamlmigrate.ast.BindingPayload;
import info.isaksson.erland.xamlmigrate.ast.MarkupExtensionKind;
import info.isaksson.erland.xamlmigrate.ast.MarkupParameter;
import info.isaksson.erland.xamlmigrate.ast.ResourcePayload;
import info.isaksson.erland.xamlmigrate.ast.StaticMemberPayload;
import info.isaksson.erland.xamlmigrate.ast.TypeReferencePayload;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MarkupExtensionParserTest {

    @Test
    void nestedExtensionIsParsedAsParameterValue() {
        String text = "{Binding Path=Value, Converter={StaticResource MyConverter}}";
        XamlMarkupExtension ext = MarkupExtensionParser.parse(text);

        assertEquals("Binding", ext.getName());
        assertNull(ext.getPositionalArgument());
        assertEquals("Value", ext.getNamedParameter("Path").getLiteral());

        MarkupParameter converter = ext.getNamedParameter("Converter");
        assertTrue(converter.isExtension());
        assertEquals("StaticResource", converter.getExtension().getName());
        assertEquals("MyConverter", converter.getExtension().getPositionalArgument().getLiteral());
        assertSame(ext, converter.getExtension().getParent());

        assertEquals(text, ext.toMarkupString());
    }

    @Test
    void bindingPayloadExposesPathAndConverterKey() {
        XamlMarkupExtension ext = MarkupExtensionParser.parse("{Binding Path=Value, Converter={StaticResource MyConverter}, Mode=TwoWay}");

        BindingPayload binding = assertInstanceOf(BindingPayload.class, ext.getPayload());
        assertEquals("Value", binding.path);
        assertEquals("TwoWay", binding.mode);
        assertEquals("MyConverter", binding.converterResourceKey());
        assertFalse(binding.templateBinding);
    }

    @Test
    void quotedBraceLiteralIsNotTreatedAsNestedExtension() {
        XamlMarkupExtension ext = MarkupExtensionParser.parse("{Binding StringFormat='{0}'}");

        MarkupParameter format = ext.getNamedParameter("StringFormat");
        assertFalse(format.isExtension());
        assertTrue(format.isQuoted());
        assertEquals("{0}", format.getLiteral());
        assertEquals("{0}", ((BindingPayload) ext.getPayload()).stringFormat);
        assertEquals("{Binding StringFormat='{0}'}", ext.toMarkupString());
    }

    @Test
    void quotedLiteralMayContainCommasAndEscapedQuotes() {
        XamlMarkupExtension ext = MarkupExtensionParser.parse("{Binding Path=Total, StringFormat='Total: {0:N2}, \\'net\\''}");

        assertEquals("Total: {0:N2}, 'net'", ext.getNamedParameter("StringFormat").getLiteral());
        assertEquals("{Binding Path=Total, StringFormat='Total: {0:N2}, \\'net\\''}", ext.toMarkupString());
    }

    @Test
    void positionalArgumentWithoutEqualsTakesWholeText() {
        XamlMarkupExtension ext = MarkupExtensionParser.parse("{StaticResource My Brush}");

        assertEquals("My Brush", ext.getPositionalArgument().getLiteral());
        assertTrue(ext.getNamedParameters().isEmpty());
        assertEquals("My Brush", ((ResourcePayload) ext.getPayload()).resourceKey);
    }

    @Test
    void positionalArgumentMayPrecedeNamedArguments() {
        XamlMarkupExtension ext = MarkupExtensionParser.parse("{Binding Title, Mode=OneWay}");

        assertEquals("Title", ext.getPositionalArgument().getLiteral());
        assertEquals("OneWay", ext.getNamedParameter("Mode").getLiteral());
        assertEquals("Title", ((BindingPayload) ext.getPayload()).path);
        assertEquals("{Binding Title, Mode=OneWay}", ext.toMarkupString());
    }

    @Test
    void payloadTableCoversResourceTypeAndStaticExtensions() {
        XamlMarkupExtension dynamic = MarkupExtensionParser.parse("{DynamicResource AccentBrush}");
        assertTrue(((ResourcePayload) dynamic.getPayload()).dynamic);

        XamlMarkupExtension type = MarkupExtensionParser.parse("{x:Type local:MyControl}");
        assertEquals(MarkupExtensionKind.TYPE, type.extensionKind());
        TypeReferencePayload t = (TypeReferencePayload) type.getPayload();
        assertEquals("local", t.prefix());
        assertEquals("MyControl", t.localTypeName());

        XamlMarkupExtension stat = MarkupExtensionParser.parse("{x:Static SystemColors.HighlightBrush}");
        StaticMemberPayload s = (StaticMemberPayload) stat.getPayload();
        assertEquals("SystemColors", s.ownerTypeName);
        assertEquals("HighlightBrush", s.memberName);

        XamlMarkupExtension nul = MarkupExtensionParser.parse("{x:Null}");
        assertEquals(MarkupExtensionKind.NULL, nul.extensionKind());
        assertNull(nul.getPayload());
        assertEquals("{x:Null}", nul.toMarkupString());
    }

    @Test
    void templateBindingUsesPositionalPropertyAsPath() {
        XamlMarkupExtension ext = MarkupExtensionParser.parse("{TemplateBinding Background}");
        BindingPayload b = (BindingPayload) ext.getPayload();
        assertTrue(b.templateBinding);
        assertEquals("Background", b.path);
    }

    @Test
    void relativeSourceIsNestedExtension() {
        XamlMarkupExtension ext = MarkupExtensionParser.parse(
                "{Binding DataContext.Items, RelativeSource={RelativeSource AncestorType={x:Type Window}}}");

        BindingPayload b = (BindingPayload) ext.getPayload();
        assertNotNull(b.relativeSource);
        XamlMarkupExtension ancestor = b.relativeSource.getNamedParameter("AncestorType").getExtension();
        assertEquals("Window", ((TypeReferencePayload) ancestor.getPayload()).typeName);
        assertEquals("DataContext.Items", b.path);
        assertEquals(1, ext.nestedExtensions().size());
    }

    @Test
    void escapedValuesAreNotExtensions() {
        assertFalse(MarkupExtensionParser.isMarkupExtension("{}{Binding}"));
        assertEquals("{Binding}", MarkupExtensionParser.unescape("{}{Binding}"));
        assertFalse(MarkupExtensionParser.isMarkupExtension("plain"));
        assertFalse(MarkupExtensionParser.isMarkupExtension(null));
        assertTrue(MarkupExtensionParser.isMarkupExtension("{Binding}"));
    }

    @Test
    void escapedBraceInsideParameterStaysLiteral() {
        XamlMarkupExtension ext = MarkupExtensionParser.parse("{Binding Price, StringFormat={}{0:C}}");

        MarkupParameter format = ext.getNamedParameter("StringFormat");
        assertFalse(format.isExtension());
        assertEquals("{}{0:C}", format.getLiteral());
        assertEquals("{Binding Price, StringFormat={}{0:C}}", ext.toMarkupString());
    }

    @Test
    void malformedInputThrowsWithPosition() {
        MarkupSyntaxException e1 = assertThrows(MarkupSyntaxException.class, () -> MarkupExtensionParser.parse("{Binding Path=Value"));
        assertTrue(e1.getPosition() >= 0);
        assertThrows(MarkupSyntaxException.class, () -> MarkupExtensionParser.parse("{ }"));
        assertThrows(MarkupSyntaxException.class, () -> MarkupExtensionParser.parse("{Binding StringFormat='{0}}"));
        assertThrows(MarkupSyntaxException.class, () -> MarkupExtensionParser.parse("{Binding Mode=OneWay, Title}"));
        assertThrows(MarkupSyntaxException.class, () -> MarkupExtensionParser.parse("{Binding} trailing"));
    }

    @Test
    void printerQuotesLiteralsThatWouldOtherwiseSplit() {
        XamlMarkupExtension ext = MarkupExtensionParser.parse("{Binding Path=Name}");
        ext.setNamedParameter("FallbackValue", MarkupParameter.literal("a, b"));

        assertEquals("{Binding Path=Name, FallbackValue='a, b'}", ext.toMarkupString());
        assertEquals("a, b", MarkupExtensionParser.parse(ext.toMarkupString()).getNamedParameter("FallbackValue").getLiteral());
    }
}

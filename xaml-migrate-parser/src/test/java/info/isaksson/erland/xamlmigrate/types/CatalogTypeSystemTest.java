package info.isaksson.erland.xamlmigrate.types;

import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;
import info.isaksson.erland.xamlmigrate.ast.XamlPropertyDescriptor;
import info.isaksson.erland.xamlmigrate.ast.XamlTypeDescriptor;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogTypeSystemTest {

    private static final String WPF = XamlNamespaces.WPF_PRESENTATION;

    @Test
    void bundledCatalogResolvesControlsAndInheritedMembers() {
        CatalogTypeSystem ts = CatalogTypeSystem.defaults();
        assertSame(ts, CatalogTypeSystem.defaults());
        assertTrue(ts.typeCount() > 40);

        XamlTypeDescriptor button = ts.resolveType(WPF, "Button");
        assertNotNull(button);
        assertEquals("System.Windows.Controls.Button", button.fullName);
        assertEquals("ButtonBase", button.baseTypeName);

        XamlPropertyDescriptor content = ts.resolveMember(button, "Content");
        assertEquals("System.Windows.Controls.ContentControl", content.declaringTypeName);
        assertFalse(content.event);

        XamlPropertyDescriptor visibility = ts.resolveMember(button, "Visibility");
        assertEquals("System.Windows.FrameworkElement", visibility.declaringTypeName);
        assertEquals("System.Windows.Visibility", visibility.propertyTypeName);

        assertTrue(ts.resolveMember(button, "Click").event);
        assertTrue(ts.resolveMember(button, "Loaded").event);
        assertNull(ts.resolveMember(button, "NoSuchMember"));
        assertNull(ts.resolveType(WPF, "NoSuchControl"));
    }

    @Test
    void attachedMembersRequireTheAttachedFlag() {
        CatalogTypeSystem ts = CatalogTypeSystem.defaults();
        XamlPropertyDescriptor row = ts.resolveAttachedMember(WPF, "Grid", "Row");
        assertNotNull(row);
        assertTrue(row.attached);
        assertNull(ts.resolveAttachedMember(WPF, "Grid", "ShowGridLines"));
        assertNull(ts.resolveAttachedMember(WPF, "Unknown", "Row"));
    }

    @Test
    void markupExtensionsResolveWithAndWithoutSuffix() {
        CatalogTypeSystem ts = CatalogTypeSystem.defaults();
        assertEquals("StaticResourceExtension", ts.resolveMarkupExtension(WPF, "StaticResource").name);
        assertEquals("Binding", ts.resolveMarkupExtension(WPF, "Binding").name);
        assertEquals("StaticExtension", ts.resolveMarkupExtension(XamlNamespaces.XAML_LANGUAGE, "Static").name);
        assertNull(ts.resolveMarkupExtension(WPF, "Button"));
    }

    @Test
    void coverageIsPerNamespace() {
        CatalogTypeSystem ts = CatalogTypeSystem.defaults();
        assertTrue(ts.coversNamespace(WPF));
        assertTrue(ts.coversNamespace(XamlNamespaces.XAML_LANGUAGE));
        assertFalse(ts.coversNamespace("clr-namespace:Sample"));
        assertFalse(ts.coversNamespace(null));
    }

    @Test
    void customCatalogWithCyclicBaseTypesTerminates() throws Exception {
        String json = "{\"namespaces\":[{\"uri\":\"urn:t\",\"types\":["
                + "{\"name\":\"A\",\"baseType\":\"B\",\"properties\":[{\"name\":\"X\"}]},"
                + "{\"name\":\"B\",\"baseType\":\"A\",\"events\":[\"Fired\"],\"unknown\":1}]}]}";
        CatalogTypeSystem ts = new CatalogTypeSystem(CatalogTypeSystem.readFromString(json));

        XamlTypeDescriptor a = ts.resolveType("urn:t", "A");
        assertEquals("A", a.fullName);
        assertEquals("A", ts.resolveMember(a, "X").declaringTypeName);
        assertTrue(ts.resolveMember(a, "Fired").event);
        assertNull(ts.resolveMember(a, "Missing"));
        assertEquals(2, ts.typeCount());
    }

    @Test
    void missingResourceIsReported() {
        assertThrows(FileNotFoundException.class, () -> CatalogTypeSystem.readResource("no/such/catalog.json"));
        assertThrows(IllegalArgumentException.class, () -> new CatalogTypeSystem(null));
    }
}

package info.isaksson.erland.xamlmigrate.ast;

import java.util.Objects;

/** Resolved property (or event) information attached to a property by the semantic layer. */
public final class XamlPropertyDescriptor {

    public final String name;

    /** Simple name of the type declaring the member; for attached members this is the owner type. */
    public final String declaringTypeName;

    public final String propertyTypeName;
    public final boolean attached;
    public final boolean event;

    public XamlPropertyDescriptor(String name, String declaringTypeName, String propertyTypeName, boolean attached, boolean event) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.declaringTypeName = declaringTypeName;
        this.propertyTypeName = propertyTypeName;
        this.attached = attached;
        this.event = event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof XamlPropertyDescriptor)) return false;
        XamlPropertyDescriptor that = (XamlPropertyDescriptor) o;
        return attached == that.attached && event == that.event
                && name.equals(that.name)
                && Objects.equals(declaringTypeName, that.declaringTypeName)
                && Objects.equals(propertyTypeName, that.propertyTypeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, declaringTypeName, propertyTypeName, attached, event);
    }

    @Override
    public String toString() {
        return (declaringTypeName == null ? "" : declaringTypeName + ".") + name;
    }
}

package info.isaksson.erland.xamlmigrate.ast;

public enum PropertyKind {
    /** {@code Name="value"} on the opening tag. */
    ATTRIBUTE,
    /** {@code <Owner.Name>...</Owner.Name>} child element. */
    PROPERTY_ELEMENT,
    /** {@code Owner.Name="value"} defined by a type other than the element's own. */
    ATTACHED_PROPERTY
}

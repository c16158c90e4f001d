package io.hearthwarrio.selectorium.core;

import java.util.Objects;

/**
 * Attribute snapshot of one captured DOM element at one point in time.
 * <p>
 * Fingerprints are produced by the in-page walker (see {@link FingerprintWalker}) and consumed by the
 * selector engine. They are only meaningful for the snapshot they were captured in: {@link #getRef()} is unique
 * within that snapshot and {@link #getParentRef()} points to the nearest <em>captured</em> ancestor in it.
 * <p>
 * Absent string attributes are normalized to an empty string, never {@code null}.
 */
public final class ElementFingerprint {

    /**
     * Marker for an unknown sibling index.
     */
    public static final int UNKNOWN_INDEX = -1;

    private final String ref;
    private final String tagName;
    private final String role;
    private final String text;
    private final String textFull;
    private final String id;
    private final String name;
    private final String cssClasses;
    private final String type;
    private final String href;
    private final String placeholder;
    private final String ariaLabel;
    private final String title;
    private final String alt;
    private final String computedLabel;
    private final String associatedLabel;

    /**
     * Test/qa hooks: {@code data-testid}, {@code data-test-id} and {@code data-qa}.
     */
    private final String dataTestId;
    private final String dataTestIdAlt;
    private final String dataQa;

    private final boolean visible;
    private final BoundingBox bounds;
    private final int nthIndex;
    private final String parentRef;
    private final boolean interactive;

    private ElementFingerprint(Builder b) {
        this.ref = normalizeNull(b.ref);
        this.tagName = normalizeNull(b.tagName);
        this.role = normalizeNull(b.role);
        this.text = normalizeNull(b.text);
        this.textFull = normalizeNull(b.textFull);
        this.id = normalizeNull(b.id);
        this.name = normalizeNull(b.name);
        this.cssClasses = normalizeNull(b.cssClasses);
        this.type = normalizeNull(b.type);
        this.href = normalizeNull(b.href);
        this.placeholder = normalizeNull(b.placeholder);
        this.ariaLabel = normalizeNull(b.ariaLabel);
        this.title = normalizeNull(b.title);
        this.alt = normalizeNull(b.alt);
        this.computedLabel = normalizeNull(b.computedLabel);
        this.associatedLabel = normalizeNull(b.associatedLabel);
        this.dataTestId = normalizeNull(b.dataTestId);
        this.dataTestIdAlt = normalizeNull(b.dataTestIdAlt);
        this.dataQa = normalizeNull(b.dataQa);
        this.visible = b.visible;
        this.bounds = b.bounds == null ? BoundingBox.EMPTY : b.bounds;
        this.nthIndex = b.nthIndex < 0 ? UNKNOWN_INDEX : b.nthIndex;
        this.parentRef = normalizeNull(b.parentRef);
        this.interactive = b.interactive;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String normalizeNull(String s) {
        return s == null ? "" : s;
    }

    public String getRef() {
        return ref;
    }

    /**
     * Lower-case tag name, e.g. {@code button}.
     */
    public String getTagName() {
        return tagName;
    }

    /**
     * Explicit {@code role} attribute; empty when the element relies on its implicit role.
     */
    public String getRole() {
        return role;
    }

    /**
     * Short visible text (at most 100 characters) used for matching.
     */
    public String getText() {
        return text;
    }

    public String getTextFull() {
        return textFull;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getCssClasses() {
        return cssClasses;
    }

    public String getType() {
        return type;
    }

    public String getHref() {
        return href;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public String getAriaLabel() {
        return ariaLabel;
    }

    public String getTitle() {
        return title;
    }

    public String getAlt() {
        return alt;
    }

    /**
     * First non-empty of aria-label, placeholder, title, alt and short text.
     */
    public String getComputedLabel() {
        return computedLabel;
    }

    /**
     * Text of the {@code <label>} associated with a form control, if any.
     */
    public String getAssociatedLabel() {
        return associatedLabel;
    }

    public String getDataTestId() {
        return dataTestId;
    }

    public String getDataTestIdAlt() {
        return dataTestIdAlt;
    }

    public String getDataQa() {
        return dataQa;
    }

    public boolean isVisible() {
        return visible;
    }

    public BoundingBox getBounds() {
        return bounds;
    }

    /**
     * 0-based position among siblings with the same tag and role, or {@link #UNKNOWN_INDEX}.
     */
    public int getNthIndex() {
        return nthIndex;
    }

    public boolean hasNthIndex() {
        return nthIndex != UNKNOWN_INDEX;
    }

    /**
     * Reference of the nearest captured ancestor; empty for top-level elements.
     */
    public String getParentRef() {
        return parentRef;
    }

    public boolean isInteractive() {
        return interactive;
    }

    @Override
    public String toString() {
        return "ElementFingerprint{" +
                "ref='" + ref + '\'' +
                ", tagName='" + tagName + '\'' +
                ", role='" + role + '\'' +
                ", text='" + text + '\'' +
                ", id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", dataTestId='" + dataTestId + '\'' +
                ", dataTestIdAlt='" + dataTestIdAlt + '\'' +
                ", dataQa='" + dataQa + '\'' +
                ", ariaLabel='" + ariaLabel + '\'' +
                ", placeholder='" + placeholder + '\'' +
                ", title='" + title + '\'' +
                ", alt='" + alt + '\'' +
                ", computedLabel='" + computedLabel + '\'' +
                ", associatedLabel='" + associatedLabel + '\'' +
                ", href='" + href + '\'' +
                ", nthIndex=" + nthIndex +
                ", parentRef='" + parentRef + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementFingerprint)) return false;
        ElementFingerprint that = (ElementFingerprint) o;
        return visible == that.visible &&
                nthIndex == that.nthIndex &&
                interactive == that.interactive &&
                Objects.equals(ref, that.ref) &&
                Objects.equals(tagName, that.tagName) &&
                Objects.equals(role, that.role) &&
                Objects.equals(text, that.text) &&
                Objects.equals(textFull, that.textFull) &&
                Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(cssClasses, that.cssClasses) &&
                Objects.equals(type, that.type) &&
                Objects.equals(href, that.href) &&
                Objects.equals(placeholder, that.placeholder) &&
                Objects.equals(ariaLabel, that.ariaLabel) &&
                Objects.equals(title, that.title) &&
                Objects.equals(alt, that.alt) &&
                Objects.equals(computedLabel, that.computedLabel) &&
                Objects.equals(associatedLabel, that.associatedLabel) &&
                Objects.equals(dataTestId, that.dataTestId) &&
                Objects.equals(dataTestIdAlt, that.dataTestIdAlt) &&
                Objects.equals(dataQa, that.dataQa) &&
                Objects.equals(bounds, that.bounds) &&
                Objects.equals(parentRef, that.parentRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                ref, tagName, role, text, textFull, id, name, cssClasses, type, href,
                placeholder, ariaLabel, title, alt, computedLabel, associatedLabel,
                dataTestId, dataTestIdAlt, dataQa, visible, bounds, nthIndex, parentRef, interactive
        );
    }

    /**
     * Mutable builder; every setter accepts {@code null} for "absent".
     */
    public static final class Builder {
        private String ref;
        private String tagName;
        private String role;
        private String text;
        private String textFull;
        private String id;
        private String name;
        private String cssClasses;
        private String type;
        private String href;
        private String placeholder;
        private String ariaLabel;
        private String title;
        private String alt;
        private String computedLabel;
        private String associatedLabel;
        private String dataTestId;
        private String dataTestIdAlt;
        private String dataQa;
        private boolean visible = true;
        private BoundingBox bounds;
        private int nthIndex = UNKNOWN_INDEX;
        private String parentRef;
        private boolean interactive;

        private Builder() {
        }

        public Builder ref(String ref) {
            this.ref = ref;
            return this;
        }

        public Builder tagName(String tagName) {
            this.tagName = tagName;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder textFull(String textFull) {
            this.textFull = textFull;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder cssClasses(String cssClasses) {
            this.cssClasses = cssClasses;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder href(String href) {
            this.href = href;
            return this;
        }

        public Builder placeholder(String placeholder) {
            this.placeholder = placeholder;
            return this;
        }

        public Builder ariaLabel(String ariaLabel) {
            this.ariaLabel = ariaLabel;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder alt(String alt) {
            this.alt = alt;
            return this;
        }

        public Builder computedLabel(String computedLabel) {
            this.computedLabel = computedLabel;
            return this;
        }

        public Builder associatedLabel(String associatedLabel) {
            this.associatedLabel = associatedLabel;
            return this;
        }

        public Builder dataTestId(String dataTestId) {
            this.dataTestId = dataTestId;
            return this;
        }

        public Builder dataTestIdAlt(String dataTestIdAlt) {
            this.dataTestIdAlt = dataTestIdAlt;
            return this;
        }

        public Builder dataQa(String dataQa) {
            this.dataQa = dataQa;
            return this;
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder bounds(BoundingBox bounds) {
            this.bounds = bounds;
            return this;
        }

        public Builder nthIndex(int nthIndex) {
            this.nthIndex = nthIndex;
            return this;
        }

        public Builder parentRef(String parentRef) {
            this.parentRef = parentRef;
            return this;
        }

        public Builder interactive(boolean interactive) {
            this.interactive = interactive;
            return this;
        }

        public ElementFingerprint build() {
            return new ElementFingerprint(this);
        }
    }
}

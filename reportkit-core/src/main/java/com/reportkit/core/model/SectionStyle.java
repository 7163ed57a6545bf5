package com.reportkit.core.model;

import java.util.Objects;

/**
 * Presentation options for a section. Only renderers that support formatting
 * give these a visual effect.
 */
public class SectionStyle {

    public static final int DEFAULT_BORDER_WIDTH = 1;

    private static final SectionStyle DEFAULT = builder().build();

    private final boolean titleBold;
    private final boolean titleItalic;
    private final boolean underline;
    private final boolean headerBold;
    private final int borderWidth;

    private SectionStyle(Builder builder) {
        this.titleBold = builder.titleBold;
        this.titleItalic = builder.titleItalic;
        this.underline = builder.underline;
        this.headerBold = builder.headerBold;
        this.borderWidth = builder.borderWidth;
    }

    public static SectionStyle defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isTitleBold() {
        return titleBold;
    }

    public boolean isTitleItalic() {
        return titleItalic;
    }

    public boolean isUnderline() {
        return underline;
    }

    public boolean isHeaderBold() {
        return headerBold;
    }

    /**
     * Border width as configured, possibly negative.
     */
    public int getBorderWidth() {
        return borderWidth;
    }

    /**
     * Border width clamped to zero.
     */
    public int getEffectiveBorderWidth() {
        return Math.max(0, borderWidth);
    }

    public Builder toBuilder() {
        return new Builder()
                .titleBold(titleBold)
                .titleItalic(titleItalic)
                .underline(underline)
                .headerBold(headerBold)
                .borderWidth(borderWidth);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SectionStyle that = (SectionStyle) o;
        return titleBold == that.titleBold &&
               titleItalic == that.titleItalic &&
               underline == that.underline &&
               headerBold == that.headerBold &&
               borderWidth == that.borderWidth;
    }

    @Override
    public int hashCode() {
        return Objects.hash(titleBold, titleItalic, underline, headerBold, borderWidth);
    }

    @Override
    public String toString() {
        return "SectionStyle{bold=" + titleBold +
                ", italic=" + titleItalic +
                ", underline=" + underline +
                ", headerBold=" + headerBold +
                ", borderWidth=" + borderWidth + '}';
    }

    public static class Builder {
        private boolean titleBold;
        private boolean titleItalic;
        private boolean underline;
        private boolean headerBold;
        private int borderWidth = DEFAULT_BORDER_WIDTH;

        public Builder titleBold(boolean titleBold) {
            this.titleBold = titleBold;
            return this;
        }

        public Builder titleItalic(boolean titleItalic) {
            this.titleItalic = titleItalic;
            return this;
        }

        public Builder underline(boolean underline) {
            this.underline = underline;
            return this;
        }

        public Builder headerBold(boolean headerBold) {
            this.headerBold = headerBold;
            return this;
        }

        public Builder borderWidth(int borderWidth) {
            this.borderWidth = borderWidth;
            return this;
        }

        public SectionStyle build() {
            return new SectionStyle(this);
        }
    }
}

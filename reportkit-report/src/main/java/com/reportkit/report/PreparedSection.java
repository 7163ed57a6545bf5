package com.reportkit.report;

import com.reportkit.core.model.Section;
import com.reportkit.core.model.TabularData;

/**
 * A validated section together with its data after calculated columns were applied.
 */
public class PreparedSection {

    private final Section section;
    private final TabularData data;

    public PreparedSection(Section section, TabularData data) {
        this.section = section;
        this.data = data;
    }

    public Section getSection() {
        return section;
    }

    public TabularData getData() {
        return data;
    }
}

package com.reportkit.core.model;

import java.util.Objects;

/**
 * One labeled entry in a section's summary block.
 * Either an aggregate over a column or a manually supplied value.
 */
public class SummaryItem {

    private final String label;
    private final SummaryCalcType calcType;
    private final String columnName;
    private final String conditionValue;
    private final String manualValue;

    public SummaryItem(String label, SummaryCalcType calcType, String columnName,
                       String conditionValue, String manualValue) {
        this.label = Objects.requireNonNull(label, "label");
        this.calcType = Objects.requireNonNull(calcType, "calcType");
        this.columnName = columnName;
        this.conditionValue = conditionValue;
        this.manualValue = manualValue;
    }

    public static SummaryItem of(String label, SummaryCalcType calcType, String columnName) {
        return new SummaryItem(label, calcType, columnName, null, null);
    }

    public static SummaryItem sum(String label, String columnName) {
        return of(label, SummaryCalcType.SUM, columnName);
    }

    public static SummaryItem average(String label, String columnName) {
        return of(label, SummaryCalcType.AVG, columnName);
    }

    public static SummaryItem min(String label, String columnName) {
        return of(label, SummaryCalcType.MIN, columnName);
    }

    public static SummaryItem max(String label, String columnName) {
        return of(label, SummaryCalcType.MAX, columnName);
    }

    public static SummaryItem count(String label, String columnName) {
        return of(label, SummaryCalcType.COUNT, columnName);
    }

    public static SummaryItem countIf(String label, String columnName, String conditionValue) {
        return new SummaryItem(label, SummaryCalcType.COUNT_IF, columnName, conditionValue, null);
    }

    public static SummaryItem manual(String label, String manualValue) {
        return new SummaryItem(label, SummaryCalcType.MANUAL, null, null, manualValue);
    }

    public String getLabel() {
        return label;
    }

    public SummaryCalcType getCalcType() {
        return calcType;
    }

    public String getColumnName() {
        return columnName;
    }

    public String getConditionValue() {
        return conditionValue;
    }

    public String getManualValue() {
        return manualValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SummaryItem that = (SummaryItem) o;
        return label.equals(that.label) &&
               calcType == that.calcType &&
               Objects.equals(columnName, that.columnName) &&
               Objects.equals(conditionValue, that.conditionValue) &&
               Objects.equals(manualValue, that.manualValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, calcType, columnName, conditionValue, manualValue);
    }

    @Override
    public String toString() {
        return "SummaryItem{" +
                "label='" + label + '\'' +
                ", calcType=" + calcType +
                ", columnName='" + columnName + '\'' +
                (conditionValue != null ? ", conditionValue='" + conditionValue + '\'' : "") +
                (manualValue != null ? ", manualValue='" + manualValue + '\'' : "") +
                '}';
    }
}

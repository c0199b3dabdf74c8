package com.tallybook.ledger.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps sheet columns onto the import schema. Aliases accept the field names
 * used by the older upload form ({@code product}, {@code price_cols}, ...).
 */
public class ColumnMapping {
    @JsonAlias({"name_column", "product"})
    private String nameColumn;

    @JsonAlias({"date_column", "date"})
    private String dateColumn;

    @JsonAlias({"value_groups", "price_cols"})
    private List<ValueColumnGroup> valueGroups = new ArrayList<>();

    @JsonAlias({"quantity_column", "qty"})
    private String quantityColumn;

    public ColumnMapping() {}

    public ColumnMapping(String nameColumn, String dateColumn, List<ValueColumnGroup> valueGroups, String quantityColumn) {
        this.nameColumn = nameColumn;
        this.dateColumn = dateColumn;
        this.valueGroups = valueGroups;
        this.quantityColumn = quantityColumn;
    }

    public String getNameColumn() { return nameColumn; }
    public void setNameColumn(String nameColumn) { this.nameColumn = nameColumn; }
    public String getDateColumn() { return dateColumn; }
    public void setDateColumn(String dateColumn) { this.dateColumn = dateColumn; }
    public List<ValueColumnGroup> getValueGroups() { return valueGroups; }
    public void setValueGroups(List<ValueColumnGroup> valueGroups) { this.valueGroups = valueGroups; }
    public String getQuantityColumn() { return quantityColumn; }
    public void setQuantityColumn(String quantityColumn) { this.quantityColumn = quantityColumn; }
}

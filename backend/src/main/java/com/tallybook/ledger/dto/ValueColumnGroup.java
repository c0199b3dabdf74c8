package com.tallybook.ledger.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/** One price column of the sheet and the company its values belong to. */
public class ValueColumnGroup {
    private String column;

    @JsonAlias({"company"})
    private String partner;

    @JsonAlias({"value_type", "price_type"})
    private String valueType;

    public ValueColumnGroup() {}

    public ValueColumnGroup(String column, String partner, String valueType) {
        this.column = column;
        this.partner = partner;
        this.valueType = valueType;
    }

    public String getColumn() { return column; }
    public void setColumn(String column) { this.column = column; }
    public String getPartner() { return partner; }
    public void setPartner(String partner) { this.partner = partner; }
    public String getValueType() { return valueType; }
    public void setValueType(String valueType) { this.valueType = valueType; }
}

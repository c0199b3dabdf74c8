package com.tallybook.ledger.dto;

public class ImportErrorDTO {
    private Integer rowNo;
    private String rawRow;
    private String errorMessage;

    public ImportErrorDTO() {}

    public ImportErrorDTO(Integer rowNo, String rawRow, String errorMessage) {
        this.rowNo = rowNo;
        this.rawRow = rawRow;
        this.errorMessage = errorMessage;
    }

    public Integer getRowNo() { return rowNo; }
    public void setRowNo(Integer rowNo) { this.rowNo = rowNo; }
    public String getRawRow() { return rawRow; }
    public void setRawRow(String rawRow) { this.rawRow = rawRow; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
}

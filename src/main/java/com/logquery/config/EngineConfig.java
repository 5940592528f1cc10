package com.logquery.config;

/**
 * 查询引擎运行时配置
 *
 * 支持从CLI参数注入，覆盖Constants默认值；引擎构造时读取一次，之后不再变化
 */
public class EngineConfig {
    private FieldAliasTable fieldAliases = FieldAliasTable.defaults();
    private NumericFieldSet numericFields = NumericFieldSet.defaults();
    private String rawTextColumn = Constants.RAW_TEXT_COLUMN;
    private String fullTextField = Constants.FULL_TEXT_FIELD;
    private int maxQueryLength = Constants.MAX_QUERY_LENGTH;

    public FieldAliasTable getFieldAliases() {
        return fieldAliases;
    }

    public void setFieldAliases(FieldAliasTable fieldAliases) {
        this.fieldAliases = fieldAliases;
    }

    public NumericFieldSet getNumericFields() {
        return numericFields;
    }

    public void setNumericFields(NumericFieldSet numericFields) {
        this.numericFields = numericFields;
    }

    public String getRawTextColumn() {
        return rawTextColumn;
    }

    public void setRawTextColumn(String rawTextColumn) {
        this.rawTextColumn = rawTextColumn;
    }

    public String getFullTextField() {
        return fullTextField;
    }

    public void setFullTextField(String fullTextField) {
        this.fullTextField = fullTextField;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}

package com.cloudcrud.model.result;

import lombok.Data;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Class name and field names, as reported by listTables
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableSummary {

    private String className;
    private List<String> fields;
}

package org.csits.odrep.server.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 已记录的增量水位：值与所在列。
 */
@Data
@AllArgsConstructor
public class Watermark {

    private String value;

    private String columnName;
}

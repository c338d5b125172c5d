/* (C)2026 */
package com.ammann.idgap.dto;

/**
 * Generated CSV export of missing IDs.
 *
 * @param fileName suggested download file name
 * @param content UTF-8 encoded CSV content
 * @param rowCount number of data rows (header excluded)
 */
public record CsvExportDTO(String fileName, byte[] content, long rowCount) {
}

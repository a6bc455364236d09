package org.carball.recon.model.date;

/**
 * A value whose shape was ISO but whose content is not a possible date.
 *
 * @param row 1-based data row the value was read from; the header row is not counted
 */
public record InvalidDateSample(String fileId, String field, int row, String rawValue, FormatTag reason) {
}

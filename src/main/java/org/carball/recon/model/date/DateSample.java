package org.carball.recon.model.date;

public record DateSample(String rawValue, FormatTag tag) {
}

package org.carball.recon.model.analysis;

public record FileFailure(String fileId, String reason) {
}

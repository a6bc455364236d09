package org.carball.recon.model.table;

@FunctionalInterface
public interface TableSource {

    RawTable load() throws TableLoadException;
}

package com.barthel.tariffshock.application.exception;

public class SectorNotFoundException extends RuntimeException {
    public SectorNotFoundException(String sectorId) {
        super("Sector not found: " + sectorId);
    }
}

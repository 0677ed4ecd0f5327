package org.carball.pvadvisor.model.analysis;

public record SheetScore(
        String sheetName,
        int score
) {}

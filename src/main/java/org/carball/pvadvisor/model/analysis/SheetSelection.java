package org.carball.pvadvisor.model.analysis;

import org.carball.pvadvisor.model.sheet.SheetDescriptor;

import java.util.List;

public record SheetSelection(
        SheetDescriptor sheet,
        int score,
        double confidence,
        List<SheetScore> scores
) {}

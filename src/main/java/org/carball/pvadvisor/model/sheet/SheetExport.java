package org.carball.pvadvisor.model.sheet;

import java.util.List;

/**
 * All worksheets of one uploaded file, in file order.
 */
public record SheetExport(
        String sourceFile,
        List<SheetDescriptor> sheets
) {}

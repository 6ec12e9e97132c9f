package com.spreadsheet.calc.controllers;

import com.spreadsheet.calc.models.CellView;
import com.spreadsheet.calc.models.GridDimensions;
import com.spreadsheet.calc.models.SortDirection;
import com.spreadsheet.calc.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheet" is the base path. Cells are addressed by label ("B7"), ranges as "A1:C3".
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Body: { "rows": 20, "cols": 10 }; either field (or the whole body) may be omitted.
     * Creates a new empty Sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) GridDimensions request) {
        GridDimensions dimensions = request == null ? new GridDimensions() : request;
        long sheetId = sheetService.createSheet(dimensions.getRows(), dimensions.getCols());
        return ResponseEntity.ok(sheetId);
    }

    /**
     * PUT /sheet/{sheetId}/cell/{label}
     * Body: raw cell input, either an integer ("42") or a formula ("=A1+B2", "=SUM(A1:A5)").
     * A malformed formula or a circular reference is rejected with 400 and leaves the sheet unchanged.
     */
    @PutMapping("/{sheetId}/cell/{label}")
    public ResponseEntity<Void> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String label,
            @RequestBody String rawValue
    ) {
        sheetService.setCellValue(sheetId, label, rawValue);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sheet/{sheetId}/cell/{label}
     * Returns the cell's value, error state and formula text.
     */
    @GetMapping("/{sheetId}/cell/{label}")
    public ResponseEntity<CellView> getCell(@PathVariable long sheetId, @PathVariable String label) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, label));
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the values of all stored cells,
     * in the format: { "A1": 10, "B1": 20, "C1": "DIVIDE_BY_ZERO", ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, Object>> getSheet(@PathVariable long sheetId) {
        Map<String, Object> data = sheetService.getSheetData(sheetId);
        return ResponseEntity.ok(data);
    }

    @PostMapping("/{sheetId}/undo")
    public ResponseEntity<Void> undo(@PathVariable long sheetId) {
        sheetService.undo(sheetId);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheetId}/redo")
    public ResponseEntity<Void> redo(@PathVariable long sheetId) {
        sheetService.redo(sheetId);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheetId}/copy/{range}")
    public ResponseEntity<Void> copy(@PathVariable long sheetId, @PathVariable String range) {
        sheetService.copy(sheetId, range);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheetId}/cut/{range}")
    public ResponseEntity<Void> cut(@PathVariable long sheetId, @PathVariable String range) {
        sheetService.cut(sheetId, range);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /sheet/{sheetId}/paste/{label}
     * Writes the last copied or cut block with its top-left corner at {label}.
     * 409 if nothing was copied yet, 400 if the block would not fit.
     */
    @PostMapping("/{sheetId}/paste/{label}")
    public ResponseEntity<Void> paste(@PathVariable long sheetId, @PathVariable String label) {
        sheetService.paste(sheetId, label);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /sheet/{sheetId}/autofill/{range}/{label}
     * Continues the series in the single-column {range} up or down to {label}.
     */
    @PostMapping("/{sheetId}/autofill/{range}/{label}")
    public ResponseEntity<Void> autofill(
            @PathVariable long sheetId,
            @PathVariable String range,
            @PathVariable String label
    ) {
        sheetService.autofill(sheetId, range, label);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /sheet/{sheetId}/sort/{range}?direction=asc|desc
     * Sorts the rows spanned by the single-column {range} by that column.
     */
    @PostMapping("/{sheetId}/sort/{range}")
    public ResponseEntity<Void> sort(
            @PathVariable long sheetId,
            @PathVariable String range,
            @RequestParam(defaultValue = "asc") String direction
    ) {
        sheetService.sort(sheetId, range, SortDirection.fromValue(direction));
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * Returns the forward dependency graph of the sheet,
     * i.e., for each cell => the set of cells its formula reads.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * Returns the reverse dependency graph of the sheet,
     * i.e., for each cell => the set of cells whose formulas read it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/export
     * Returns the displayed values as CSV, one line per grid row.
     */
    @GetMapping(value = "/{sheetId}/export", produces = "text/csv")
    public ResponseEntity<String> exportSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.exportSheet(sheetId));
    }

    /**
     * POST /sheet/import
     * Body: CSV of integers. Creates a new Sheet sized to the text, returns the sheetId.
     */
    @PostMapping(value = "/import", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<Long> importSheet(@RequestBody String csv) {
        return ResponseEntity.ok(sheetService.importSheet(csv));
    }
}

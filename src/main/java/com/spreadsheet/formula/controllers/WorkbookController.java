package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.models.CellView;
import com.spreadsheet.formula.services.WorkbookService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for workbook sessions.
 * "/workbook" is the base path. Formula errors are cell values, never HTTP errors.
 */
@RestController
@RequestMapping("/workbook")
public class WorkbookController {

    @Autowired
    private WorkbookService workbookService;

    /**
     * POST /workbook
     * Optional JSON body { "sheetName": "Budget" }.
     * Opens a new workbook and returns its ID.
     */
    @PostMapping
    public ResponseEntity<Long> createWorkbook(@RequestBody(required = false) Map<String, String> request) {
        String sheetName = request == null ? null : request.get("sheetName");
        long workbookId = workbookService.createWorkbook(sheetName);
        return ResponseEntity.ok(workbookId);
    }

    /**
     * PUT /workbook/{workbookId}/cell/{address}
     * Body: raw input, e.g. "42", "hello" or "=SUM(A1:A3)". An empty body clears the cell.
     */
    @PutMapping("/{workbookId}/cell/{address}")
    public ResponseEntity<Void> setCellValue(
            @PathVariable long workbookId,
            @PathVariable String address,
            @RequestBody(required = false) String rawInput
    ) {
        workbookService.setCellValue(workbookId, address, rawInput);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /workbook/{workbookId}/cells
     * Body: { "A1": "10", "A2": "=A1*2" }. Writes every cell, then recalculates once.
     */
    @PutMapping("/{workbookId}/cells")
    public ResponseEntity<Void> setCellValues(@PathVariable long workbookId,
                                              @RequestBody Map<String, String> rawInputs) {
        workbookService.setCellValues(workbookId, rawInputs);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{workbookId}/cell/{address}")
    public ResponseEntity<Void> clearCell(@PathVariable long workbookId, @PathVariable String address) {
        workbookService.clearCell(workbookId, address);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{workbookId}/cell/{address}")
    public ResponseEntity<CellView> getCell(@PathVariable long workbookId, @PathVariable String address) {
        return ResponseEntity.ok(workbookService.getCell(workbookId, address));
    }

    /**
     * GET /workbook/{workbookId}
     * Returns the computed value of every non-empty cell,
     * in the format: { "A1": 10.0, "A4": 60.0, "B1": "#DIV/0!", ... }.
     */
    @GetMapping("/{workbookId}")
    public ResponseEntity<Map<String, Object>> getWorkbook(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.getWorkbookData(workbookId));
    }

    /**
     * POST /workbook/{workbookId}/evaluate?sheet=Sheet1
     * Body: formula text. Evaluates it against the workbook without storing it.
     */
    @PostMapping("/{workbookId}/evaluate")
    public ResponseEntity<CellView> evaluate(@PathVariable long workbookId,
                                             @RequestParam(required = false) String sheet,
                                             @RequestBody String formula) {
        return ResponseEntity.ok(workbookService.evaluate(workbookId, formula, sheet));
    }

    @PostMapping("/{workbookId}/recalculate")
    public ResponseEntity<Void> recalculate(@PathVariable long workbookId) {
        workbookService.recalculate(workbookId);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /workbook/{workbookId}/forwardDependencies
     * For each formula cell => the set of cells it references.
     */
    @GetMapping("/{workbookId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.getForwardDependencies(workbookId));
    }

    /**
     * GET /workbook/{workbookId}/reverseDependencies
     * For each referenced cell => the set of formula cells that reference it.
     */
    @GetMapping("/{workbookId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.getReverseDependencies(workbookId));
    }
}

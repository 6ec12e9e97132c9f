package com.spreadsheet.calc.services;

import com.spreadsheet.calc.config.SpreadsheetProperties;
import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.exceptions.EmptyBufferException;
import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.exceptions.InvalidDimensionsException;
import com.spreadsheet.calc.exceptions.InvalidRangeException;
import com.spreadsheet.calc.exceptions.NoHistoryException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellView;
import com.spreadsheet.calc.models.SortDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SheetService logic, using an in-memory approach
 * (no HTTP or external server).
 */
class SheetServiceTest {

    private SheetService sheetService;
    private long sheetId;

    @BeforeEach
    void setUp() {
        SpreadsheetProperties properties = new SpreadsheetProperties();
        properties.setDefaultRows(10);
        properties.setDefaultCols(5);
        properties.setSleepUnit(Duration.ZERO);
        sheetService = new SheetService(properties);
        sheetId = sheetService.createSheet(null, null);
    }

    @Test
    void testCreateSheetUsesDefaultsAndExplicitSize() {
        assertEquals(10, sheetService.getSheet(sheetId).getEngine().getRows());
        assertEquals(5, sheetService.getSheet(sheetId).getEngine().getCols());

        long other = sheetService.createSheet(3, 4);
        assertNotEquals(sheetId, other);
        assertEquals(3, sheetService.getSheet(other).getEngine().getRows());
        assertEquals(4, sheetService.getSheet(other).getEngine().getCols());
    }

    @Test
    void testCreateSheetRejectsBadDimensions() {
        assertThrows(InvalidDimensionsException.class, () -> sheetService.createSheet(0, 5));
        assertThrows(InvalidDimensionsException.class, () -> sheetService.createSheet(1000, 5));
    }

    @Test
    void testUnknownSheet() {
        assertThrows(SheetNotFoundException.class, () -> sheetService.getSheetData(9999L));
        assertThrows(SheetNotFoundException.class, () -> sheetService.setCellValue(9999L, "A1", "1"));
    }

    /**
     * Verify literal sets and malformed input.
     */
    @Test
    void testSetLiteralValues() {
        sheetService.setCellValue(sheetId, "A1", "10");
        sheetService.setCellValue(sheetId, "B2", "-7");

        assertThrows(FormulaParseException.class, () ->
                sheetService.setCellValue(sheetId, "C1", "hello"));
        assertThrows(FormulaParseException.class, () ->
                sheetService.setCellValue(sheetId, "C1", "=A1+"));

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(10, data.get("A1"));
        assertEquals(-7, data.get("B2"));
        assertFalse(data.containsKey("C1"));
    }

    @Test
    void testLabelOutsideGridIsRejected() {
        assertThrows(InvalidRangeException.class, () -> sheetService.setCellValue(sheetId, "F1", "1"));
        assertThrows(InvalidRangeException.class, () -> sheetService.setCellValue(sheetId, "A11", "1"));
        assertThrows(InvalidRangeException.class, () -> sheetService.getCell(sheetId, "1A"));
    }

    /**
     * C1 -> A1. Then A1 -> C1 => cycle => error, old value kept.
     */
    @Test
    void testFormulaCycle() {
        sheetService.setCellValue(sheetId, "C1", "=A1");
        sheetService.setCellValue(sheetId, "A1", "5");
        assertThrows(CircularReferenceException.class, () ->
                sheetService.setCellValue(sheetId, "A1", "=C1*2"));

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(5, data.get("A1"));
        assertEquals(5, data.get("C1"));
    }

    /**
     * Multi-cell cycle scenario: C1->A1, A1->B1, B1->C1.
     */
    @Test
    void testThreeCellCycle() {
        sheetService.setCellValue(sheetId, "C1", "=A1+1");
        sheetService.setCellValue(sheetId, "A1", "=B1+1");

        assertThrows(CircularReferenceException.class, () ->
                sheetService.setCellValue(sheetId, "B1", "=C1+1")
        );

        CellView b1 = sheetService.getCell(sheetId, "B1");
        assertEquals(0, b1.getValue());
        assertEquals("", b1.getFormula());
    }

    /**
     * Partial re-eval: updating A1 should refresh C1 if C1 reads A1.
     */
    @Test
    void testDependentsAreRecomputed() {
        sheetService.setCellValue(sheetId, "A1", "2");
        sheetService.setCellValue(sheetId, "B1", "=A1*10");
        sheetService.setCellValue(sheetId, "C1", "=SUM(A1:B1)");
        assertEquals(22, sheetService.getSheetData(sheetId).get("C1"));

        sheetService.setCellValue(sheetId, "A1", "3");
        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(30, data.get("B1"));
        assertEquals(33, data.get("C1"));
    }

    @Test
    void testErrorCellsReportErrorName() {
        sheetService.setCellValue(sheetId, "A1", "=5/B1");
        sheetService.setCellValue(sheetId, "A2", "=A1+1");

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(CellError.DIVIDE_BY_ZERO.name(), data.get("A1"));
        assertEquals(CellError.DIVIDE_BY_ZERO.name(), data.get("A2"));

        CellView a1 = sheetService.getCell(sheetId, "A1");
        assertNull(a1.getValue());
        assertEquals("=5/B1", a1.getFormula());
    }

    @Test
    void testUndoRedo() {
        sheetService.setCellValue(sheetId, "A1", "1");
        sheetService.setCellValue(sheetId, "A1", "2");

        sheetService.undo(sheetId);
        assertEquals(1, sheetService.getSheetData(sheetId).get("A1"));
        sheetService.redo(sheetId);
        assertEquals(2, sheetService.getSheetData(sheetId).get("A1"));

        sheetService.undo(sheetId);
        sheetService.undo(sheetId);
        assertThrows(NoHistoryException.class, () -> sheetService.undo(sheetId));
    }

    @Test
    void testCopyPasteAndEmptyBuffer() {
        assertThrows(EmptyBufferException.class, () -> sheetService.paste(sheetId, "A1"));

        sheetService.setCellValue(sheetId, "A1", "4");
        sheetService.setCellValue(sheetId, "B1", "=A1*2");
        sheetService.copy(sheetId, "A1:B1");
        sheetService.paste(sheetId, "A3");

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(4, data.get("A3"));
        assertEquals(8, data.get("B3"));
        assertEquals("", sheetService.getCell(sheetId, "B3").getFormula());

        assertThrows(InvalidRangeException.class, () -> sheetService.paste(sheetId, "E1"));
    }

    @Test
    void testAutofillAndSort() {
        sheetService.setCellValue(sheetId, "A1", "3");
        sheetService.setCellValue(sheetId, "A2", "6");
        sheetService.autofill(sheetId, "A1:A2", "A5");

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(9, data.get("A3"));
        assertEquals(15, data.get("A5"));

        sheetService.sort(sheetId, "A1:A5", SortDirection.DESCENDING);
        data = sheetService.getSheetData(sheetId);
        assertEquals(15, data.get("A1"));
        assertEquals(3, data.get("A5"));
    }

    @Test
    void testDependencyGraphsUseLabels() {
        sheetService.setCellValue(sheetId, "B1", "=C2+1");
        sheetService.setCellValue(sheetId, "A1", "=B1+1");

        Map<String, Set<String>> forward = sheetService.getForwardDependencies(sheetId);
        assertEquals(Set.of("C2"), forward.get("B1"));
        assertEquals(Set.of("B1"), forward.get("A1"));
        assertTrue(forward.get("C2").isEmpty());

        Map<String, Set<String>> reverse = sheetService.getReverseDependencies(sheetId);
        assertEquals(Set.of("B1"), reverse.get("C2"));
        assertEquals(Set.of("A1"), reverse.get("B1"));
        assertTrue(reverse.get("A1").isEmpty());
    }

    @Test
    void testExportAndImport() {
        sheetService.setCellValue(sheetId, "A1", "1");
        sheetService.setCellValue(sheetId, "B1", "=A1+1");

        String csv = sheetService.exportSheet(sheetId);
        List<String> lines = csv.lines().toList();
        assertEquals(10, lines.size());
        assertEquals("1,2,0,0,0", lines.get(0));

        long imported = sheetService.importSheet("1,2\n3\n");
        Map<String, Object> data = sheetService.getSheetData(imported);
        assertEquals(1, data.get("A1"));
        assertEquals(2, data.get("B1"));
        assertEquals(3, data.get("A2"));
        assertEquals(2, sheetService.getSheet(imported).getEngine().getCols());
        assertThrows(NoHistoryException.class, () -> sheetService.undo(imported));
    }

    /**
     * Simple concurrency test: ensures no concurrency errors
     * when two threads set different cells simultaneously.
     */
    @Test
    void testConcurrentCellUpdates() throws InterruptedException {
        Runnable task1 = () -> sheetService.setCellValue(sheetId, "A1", "7");
        Runnable task2 = () -> sheetService.setCellValue(sheetId, "B1", "=A2+1");

        Thread t1 = new Thread(task1);
        Thread t2 = new Thread(task2);

        t1.start();
        t2.start();
        t1.join();
        t2.join();

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(7, data.get("A1"));
        assertEquals(1, data.get("B1"));
    }
}

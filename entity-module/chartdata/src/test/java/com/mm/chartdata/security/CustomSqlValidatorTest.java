package com.mm.chartdata.security;

import com.mm.chartdata.query.ChartValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CustomSqlValidatorTest {
  private final CustomSqlValidator validator = new CustomSqlValidator();
  private final ProcedureWhitelist none = ProcedureWhitelist.empty();
  private final ProcedureWhitelist salesProcs = ProcedureWhitelist.of(List.of("dbo.usp_SalesReport"));

  @Test
  void plainSelectPassesVerbatim() {
    String sql = "SELECT Region, SUM(Amount) AS Total FROM Sales GROUP BY Region";
    SqlValidationResult r = validator.validate(sql, none);
    assertTrue(r.valid());
    assertEquals(sql, r.sanitizedQuery());
    assertFalse(r.storedProcedure());
  }

  @Test
  void passingQueryIsReturnedExactlyAsWritten() {
    String sql = "  \n SELECT  *   FROM Sales /* keep me */ \n";
    SqlValidationResult r = validator.validate(sql, none);
    assertTrue(r.valid());
    assertEquals(sql, r.sanitizedQuery());
  }

  @Test
  void cteIsAllowed() {
    String sql = "WITH t AS (SELECT 1 AS a) SELECT a FROM t";
    assertTrue(validator.validate(sql, none).valid());
    assertTrue(CustomSqlValidator.isCommonTableExpression(sql));
    assertTrue(CustomSqlValidator.isCommonTableExpression("/* totals */\n with t AS (SELECT 1 AS a) SELECT a FROM t"));
    assertFalse(CustomSqlValidator.isCommonTableExpression("SELECT Width FROM Panels"));
  }

  @Test
  void secondStatementIsRejected() {
    SqlValidationResult r = validator.validate("SELECT * FROM Sales; DROP TABLE Sales", none);
    assertFalse(r.valid());
    assertEquals("Multiple statements are not allowed", r.error());
    assertNull(r.sanitizedQuery());
  }

  @Test
  void singleTrailingSemicolonIsTolerated() {
    assertTrue(validator.validate("SELECT * FROM Sales;", none).valid());
    assertFalse(validator.validate("SELECT * FROM Sales;;", none).valid());
  }

  @Test
  void writeVerbsAreRejected() {
    assertFalse(validator.validate("DELETE FROM Sales", none).valid());
    assertFalse(validator.validate("UPDATE Sales SET Amount = 0", none).valid());
    assertFalse(validator.validate("SELECT * FROM Sales WHERE 1 = (SELECT 1) AND EXISTS (SELECT 1) DROP TABLE Sales", none).valid());
    assertFalse(validator.validate("SELECT * INTO SalesCopy FROM Sales", none).valid());
    assertFalse(validator.validate("SELECT * FROM OPENROWSET('SQLNCLI', 'x', 'SELECT 1')", none).valid());
  }

  @Test
  void systemProceduresAreRejectedEvenInsideSelect() {
    assertFalse(validator.validate("SELECT * FROM Sales WHERE Region = xp_cmdshell('dir')", none).valid());
    assertFalse(validator.validate("SELECT sp_helpdb FROM Sales", none).valid());
  }

  @Test
  void commentedOutKeywordsDoNotCountButAreKept() {
    String sql = "SELECT * FROM Sales -- never DROP this\nWHERE Amount > 0";
    SqlValidationResult r = validator.validate(sql, none);
    assertTrue(r.valid());
    assertEquals(sql, r.sanitizedQuery());
  }

  @Test
  void unionAndTooManySelectsAreRejected() {
    assertFalse(validator.validate("SELECT 1 UNION SELECT password FROM Users", none).valid());

    StringBuilder nested = new StringBuilder("SELECT * FROM Sales WHERE Amount IN (");
    for (int i = 0; i < 10; i++) nested.append("SELECT ").append(i).append(i < 9 ? ", " : "");
    nested.append(")");
    SqlValidationResult r = validator.validate(nested.toString(), none);
    assertFalse(r.valid());
    assertTrue(r.error().startsWith("Too many SELECT"));
  }

  @Test
  void emptyOrCommentOnlyIsRejected() {
    assertFalse(validator.validate(null, none).valid());
    assertFalse(validator.validate("   ", none).valid());
    assertFalse(validator.validate("-- just a note", none).valid());
  }

  @Test
  void whitelistedProcedureMayBeExecuted() {
    SqlValidationResult r = validator.validate("EXEC dbo.usp_SalesReport @Year = 2024", salesProcs);
    assertTrue(r.valid());
    assertTrue(r.storedProcedure());
    assertEquals("EXEC dbo.usp_SalesReport @Year = 2024", r.sanitizedQuery());

    assertTrue(validator.validate("EXECUTE [dbo].[usp_SalesReport]", salesProcs).valid());
    assertTrue(validator.validate("exec USP_SALESREPORT", salesProcs).valid());
  }

  @Test
  void procedureOutsideWhitelistIsRejected() {
    SqlValidationResult r = validator.validate("EXEC dbo.usp_SalesReport", none);
    assertFalse(r.valid());
    assertEquals("Stored procedure 'dbo.usp_SalesReport' is not in the allowed list", r.error());

    assertFalse(validator.validate("EXEC dbo.usp_Other", salesProcs).valid());
  }

  @Test
  void procedureCallsCannotSmuggleMoreStatements() {
    assertFalse(validator.validate("EXEC usp_SalesReport; DROP TABLE Sales", salesProcs).valid());
    assertFalse(validator.validate("EXEC usp_SalesReport -- comment", salesProcs).valid());
    assertFalse(validator.validate("EXEC usp_SalesReport /* x */", salesProcs).valid());
    SqlValidationResult nested = validator.validate("EXEC usp_SalesReport EXEC usp_Other", salesProcs);
    assertFalse(nested.valid());
    assertEquals("Nested EXEC is not allowed", nested.error());
  }

  @Test
  void requireValidThrowsClientError() {
    ChartValidationException ex = assertThrows(ChartValidationException.class,
        () -> validator.requireValid("DROP TABLE Sales", none));
    assertEquals(400, ex.getStatus().value());
    assertTrue(ex.getReason().startsWith("Unsafe SQL: "));
  }
}

package db.pesa.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.Test;

import db.pesa.error.ErrorKind;
import db.pesa.error.InvalidSchemaException;
import db.pesa.error.TypeMismatchException;

public class TableSchemaTest {

    @Test
    void exactlyOnePrimaryKey() {
        InvalidSchemaException none = assertThrows(InvalidSchemaException.class,
            () -> new TableSchema("t", List.of(ColumnSchema.of("a", DataType.INT))));
        assertEquals(ErrorKind.INVALID_SCHEMA, none.kind());
        assertThrows(InvalidSchemaException.class, () -> new TableSchema("t", List.of(
            ColumnSchema.primaryKey("a", DataType.INT), ColumnSchema.primaryKey("b", DataType.INT))));
    }

    @Test
    void duplicateColumnNamesRejected() {
        assertThrows(InvalidSchemaException.class, () -> new TableSchema("t", List.of(
            ColumnSchema.primaryKey("a", DataType.INT), ColumnSchema.of("a", DataType.STRING))));
    }

    @Test
    void lookupHelpers() {
        TableSchema s = new TableSchema("t", List.of(
            ColumnSchema.primaryKey("id", DataType.INT),
            new ColumnSchema("email", DataType.STRING, false, true, null),
            new ColumnSchema("owner", DataType.INT, false, false, new ForeignKey("users", "id")),
            ColumnSchema.of("note", DataType.STRING)));
        assertEquals(1, s.columnIndex("email"));
        assertEquals(-1, s.columnIndex("missing"));
        assertEquals("id", s.primaryKey().name());
        assertTrue(s.column("owner").indexed());
        assertFalse(s.column("owner").uniqueKey());
        assertFalse(s.column("note").indexed());
        assertEquals(List.of("id", "email", "owner", "note"), s.columnNames());
        assertEquals("owner INT REFERENCES users(id)", s.column("owner").toString());
    }

    @Test
    void floatNegativeZeroIsStoredAsZero() {
        Object v = DataType.FLOAT.coerce(-0.0, "v");
        assertEquals(0.0, v);
        assertEquals(Double.valueOf(0.0), DataType.FLOAT.coerce(0.0, "v"));
        assertEquals(-1.5, DataType.FLOAT.coerce(-1.5, "v"));
    }

    @Test
    void typeKeywordsIgnoreDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            assertEquals(DataType.INT, DataType.fromKeyword("int"));
            assertEquals(DataType.STRING, DataType.fromKeyword("string"));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void typeCoercion() {
        assertEquals(5L, DataType.INT.coerce(5, "a"));
        assertEquals(5.0, DataType.FLOAT.coerce(5L, "a"));
        assertNull(DataType.STRING.coerce(null, "a"));
        assertThrows(TypeMismatchException.class, () -> DataType.INT.coerce(1.5, "a"));
        assertThrows(TypeMismatchException.class, () -> DataType.BOOL.coerce("true", "a"));
        assertThrows(TypeMismatchException.class, () -> DataType.STRING.coerce(1L, "a"));
        assertEquals(DataType.STRING, DataType.fromKeyword("varchar"));
    }
}

package db.pesa.query;

// SET column = literal
public record Assignment(String column, Object value) {}

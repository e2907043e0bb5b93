package db.pesa.query;

/**
 * Parsed statement. Closed set: the executor handles every kind through {@link Visitor}.
 */
public sealed interface Query
    permits CreateDatabaseQuery, DropDatabaseQuery, CreateTableQuery, DropTableQuery, UseQuery,
            ShowDatabasesQuery, ShowTablesQuery, DescribeQuery,
            InsertQuery, UpdateQuery, DeleteQuery, SelectQuery {

    enum Category { DDL, DML, DQL }

    Category category();

    /** True when success changes tables of the current database, which then needs a flush. */
    default boolean mutatesTables() { return false; }

    <R, C> R accept(Visitor<R, C> visitor, C context);

    interface Visitor<R, C> {
        R visitCreateDatabase(CreateDatabaseQuery q, C context);
        R visitDropDatabase(DropDatabaseQuery q, C context);
        R visitCreateTable(CreateTableQuery q, C context);
        R visitDropTable(DropTableQuery q, C context);
        R visitUse(UseQuery q, C context);
        R visitShowDatabases(ShowDatabasesQuery q, C context);
        R visitShowTables(ShowTablesQuery q, C context);
        R visitDescribe(DescribeQuery q, C context);
        R visitInsert(InsertQuery q, C context);
        R visitUpdate(UpdateQuery q, C context);
        R visitDelete(DeleteQuery q, C context);
        R visitSelect(SelectQuery q, C context);
    }
}

package db.pesa;

import java.util.Scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.pesa.catalog.CatalogManager;
import db.pesa.catalog.Session;
import db.pesa.cli.TablePrinter;
import db.pesa.config.EngineConfig;
import db.pesa.error.DbException;
import db.pesa.query.QueryProcessor;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        EngineConfig config = EngineConfig.fromArgs(args);
        log.info("Starting with {}", config);

        CatalogManager catalog = new CatalogManager(config.dataDir);
        QueryProcessor qp = new QueryProcessor(catalog, config.autoFlush);
        Session session = new Session();

        System.out.println("pesa-db. Statements end at the end of the line; 'exit' or 'quit' to leave.\n");
        try (Scanner scanner = new Scanner(System.in)) {
            while (true) {
                String db = session.currentDatabase();
                System.out.print((db == null ? "sql" : db) + "> ");
                if (!scanner.hasNextLine()) break;
                String line = scanner.nextLine().trim();
                if (line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit")) {
                    System.out.println("Bye");
                    break;
                }
                if (line.isEmpty()) continue;
                try {
                    for (String stmt : qp.splitStatements(line)) {
                        TablePrinter.print(qp.execute(session, stmt));
                    }
                } catch (DbException ex) {
                    System.out.println(ex.kind() + ": " + ex.getMessage());
                }
            }
        }
        if (!config.autoFlush && session.currentDatabase() != null) {
            try {
                qp.flush(session);
            } catch (DbException ex) {
                System.out.println(ex.kind() + ": " + ex.getMessage());
            }
        }
    }
}

/* -------------------------------------------------------------------------
 * Example session:
 *   CREATE DATABASE school
 *   USE school
 *   CREATE TABLE students (id INT PRIMARY KEY, name STRING, active BOOL)
 *   CREATE TABLE enrollments (id INT PRIMARY KEY, student_id INT REFERENCES students(id), course STRING)
 *   INSERT INTO students VALUES (1, 'Alice', TRUE), (2, 'Bob', FALSE)
 *   INSERT INTO enrollments VALUES (100, 1, 'Math'), (101, 1, 'Physics')
 *   SELECT name, course FROM students INNER JOIN enrollments ON students.id = enrollments.student_id
 *   SELECT course, COUNT(*) AS n FROM enrollments GROUP BY course HAVING n > 0 ORDER BY n DESC
 *   DELETE FROM students WHERE id = 1   -- rejected: still referenced by enrollments
 * ------------------------------------------------------------------------- */

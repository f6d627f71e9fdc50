package com.syncgen.schemagen.naming;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InflectorTest {

    @Test
    void singularize() {
        assertEquals("task", Inflector.singularize("tasks"));
        assertEquals("category", Inflector.singularize("categories"));
        assertEquals("address", Inflector.singularize("addresses"));
        assertEquals("status", Inflector.singularize("statuses"));
        assertEquals("status", Inflector.singularize("status"));
        assertEquals("database", Inflector.singularize("databases"));
        assertEquals("person", Inflector.singularize("people"));
        assertEquals("child", Inflector.singularize("children"));
    }

    @Test
    void pluralize() {
        assertEquals("tasks", Inflector.pluralize("task"));
        assertEquals("categories", Inflector.pluralize("category"));
        assertEquals("statuses", Inflector.pluralize("status"));
        assertEquals("boxes", Inflector.pluralize("box"));
        assertEquals("quizzes", Inflector.pluralize("quiz"));
        assertEquals("people", Inflector.pluralize("person"));
        assertEquals("tasks", Inflector.pluralize("tasks"));
    }

    @Test
    void compoundNamesInflectOnlyTheLastWord() {
        assertEquals("front_message", Inflector.singularize("front_messages"));
        assertEquals("activity_logs", Inflector.pluralize("activity_log"));
        assertEquals("sales_person", Inflector.singularize("sales_people"));
    }

    @Test
    void uncountableWordsAreUnchanged() {
        assertEquals("metadata", Inflector.singularize("metadata"));
        assertEquals("news", Inflector.pluralize("news"));
        assertEquals("equipment", Inflector.pluralize("equipment"));
    }

    @Test
    void casing() {
        assertEquals("notableTask", Inflector.camelCase("notable_task"));
        assertEquals("FrontMessage", Inflector.pascalCase("front_message"));
        assertEquals("front_message", Inflector.underscore("FrontMessage"));
        assertEquals("html_parser", Inflector.underscore("HTMLParser"));
        assertEquals("", Inflector.pascalCase(null));
    }

    @Test
    void humanize() {
        assertEquals("Author", Inflector.humanize("author_id"));
        assertEquals("First name", Inflector.humanize("first_name"));
        assertEquals("Activity logs", Inflector.humanize("activity_logs"));
    }

    @Test
    void classifyAndTableize() {
        assertEquals("FrontMessage", Inflector.classify("front_messages"));
        assertEquals("Person", Inflector.classify("people"));
        assertEquals("activity_logs", Inflector.tableize("ActivityLog"));
        assertEquals("people", Inflector.tableize("Person"));
    }

    @Test
    void words() {
        assertEquals(List.of("front", "message"), Inflector.words("FrontMessage"));
        assertEquals(List.of("reminder", "time", "set"), Inflector.words("reminder_time_set"));
    }
}

package com.vidnyan.playscan.domain.ast;

import com.vidnyan.playscan.domain.model.Location;
import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.raw.RawScalar;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FreeFormArgumentsTest {

    private static final Location AT = Location.at("site.yml", 3, 7);

    @Test
    void splitsKeyValuePairsAndRawWords() {
        Map<String, RawNode> args = FreeFormArguments.parse("echo hello chdir=/tmp creates=/tmp/done", AT);

        assertEquals(List.of("chdir", "creates", FreeFormArguments.RAW_PARAMS), List.copyOf(args.keySet()));
        assertEquals("/tmp", text(args, "chdir"));
        assertEquals("echo hello", text(args, FreeFormArguments.RAW_PARAMS));
        assertEquals(AT, args.get("chdir").location());
    }

    @Test
    void quotedValuesKeepSpacesAndLoseQuotes() {
        Map<String, RawNode> args = FreeFormArguments.parse("name=bob comment='Bob the builder' password=\"\"", AT);

        assertEquals("Bob the builder", text(args, "comment"));
        assertEquals("", text(args, "password"));
    }

    @Test
    void templatesAreSingleTokens() {
        List<String> tokens = FreeFormArguments.tokenize("dest={{ base_dir }}/app mode=0644");

        assertEquals(List.of("dest={{ base_dir }}/app", "mode=0644"), tokens);
    }

    @Test
    void unterminatedQuoteIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FreeFormArguments.parse("msg='oops", AT));
    }

    @Test
    void unterminatedTemplateIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FreeFormArguments.parse("msg={{ oops", AT));
    }

    private static String text(Map<String, RawNode> args, String key) {
        return ((RawScalar) args.get(key)).asText();
    }
}

package com.vidnyan.playscan.adapter.out.yaml;

import com.vidnyan.playscan.domain.error.RawTreeLoadException;
import com.vidnyan.playscan.domain.model.Location;
import com.vidnyan.playscan.domain.raw.RawMapping;
import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.raw.RawScalar;
import com.vidnyan.playscan.domain.raw.RawSequence;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnakeYamlRawTreeLoaderTest {

    @TempDir
    Path tempDir;

    private final SnakeYamlRawTreeLoader loader = new SnakeYamlRawTreeLoader();

    @Test
    void keepsLocationsAndKeyOrder() {
        RawNode root = loader.parse("""
                - hosts: all
                  tasks:
                    - name: first
                      ping:
                """, "site.yml");

        RawSequence plays = (RawSequence) root;
        RawMapping play = (RawMapping) plays.items().get(0);
        assertEquals(Location.at("site.yml", 1, 3), play.location());
        RawMapping task = (RawMapping) ((RawSequence) play.get("tasks").orElseThrow()).items().get(0);
        assertEquals(Location.at("site.yml", 3, 7), task.location());
        assertEquals(List.of("name", "ping"), List.copyOf(task.entries().keySet()));
        assertTrue(((RawScalar) task.get("ping").orElseThrow()).isNull());
    }

    @Test
    void resolvesScalarTypes() {
        RawMapping vars = (RawMapping) loader.parse("""
                enabled: yes
                disabled: Off
                port: 8080
                mode: 0644
                mask: 0x1F
                ratio: 0.5
                version: "1.10"
                address: 0.0.0.0
                """, "vars.yml");

        assertEquals(Boolean.TRUE, value(vars, "enabled"));
        assertEquals(Boolean.FALSE, value(vars, "disabled"));
        assertEquals(8080L, value(vars, "port"));
        assertEquals(420L, value(vars, "mode"));
        assertEquals(31L, value(vars, "mask"));
        assertEquals(0.5, value(vars, "ratio"));
        assertEquals("1.10", value(vars, "version"));
        assertEquals("0.0.0.0", value(vars, "address"));
    }

    @Test
    void vaultTagMarksEncryptedScalar() {
        RawMapping vars = (RawMapping) loader.parse("""
                db_password: !vault |
                  $ANSIBLE_VAULT;1.1;AES256
                  6162636465
                """, "vars.yml");

        RawScalar password = (RawScalar) vars.get("db_password").orElseThrow();
        assertTrue(password.vaultEncrypted());
        assertEquals(RawScalar.VAULT_MARKER, password.toPlainValue());
        assertTrue(password.asText().startsWith("$ANSIBLE_VAULT"));
    }

    @Test
    void aliasesShareTheConvertedNode() {
        RawMapping root = (RawMapping) loader.parse("""
                base: &base
                  port: 80
                copy: *base
                """, "vars.yml");

        assertSame(root.get("base").orElseThrow(), root.get("copy").orElseThrow());
    }

    @Test
    void emptyDocumentIsNull() {
        RawScalar empty = (RawScalar) loader.parse("", "empty.yml");

        assertTrue(empty.isNull());
        assertEquals(Location.at("empty.yml", 1, 1), empty.location());
    }

    @Test
    void invalidYamlIsReportedWithTheFile() {
        RawTreeLoadException error = assertThrows(RawTreeLoadException.class,
                () -> loader.parse("key: [unclosed\n", "broken.yml"));

        assertEquals(Path.of("broken.yml"), error.getFile());
    }

    @Test
    void loadsFromDisk() throws IOException {
        Path file = tempDir.resolve("site.yml");
        Files.writeString(file, "- hosts: all\n");

        RawNode root = loader.load(file);

        assertEquals(file.toString(), root.location().filePath());
        assertThrows(RawTreeLoadException.class, () -> loader.load(tempDir.resolve("absent.yml")));
    }

    private static Object value(RawMapping mapping, String key) {
        return ((RawScalar) mapping.get(key).orElseThrow()).value();
    }
}

package com.vidnyan.playscan.adapter.out.yaml;

import com.vidnyan.playscan.application.port.out.RawTreeLoader;
import com.vidnyan.playscan.domain.error.RawTreeLoadException;
import com.vidnyan.playscan.domain.model.Location;
import com.vidnyan.playscan.domain.raw.RawMapping;
import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.raw.RawScalar;
import com.vidnyan.playscan.domain.raw.RawSequence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads YAML files through SnakeYAML's node graph, so every value keeps its position.
 *
 * <p>Only the composer runs: no Java objects are constructed from tags. Scalars are typed
 * with YAML 1.1 implicit resolution ({@code yes}/{@code no} are booleans), {@code !vault}
 * scalars are kept as opaque ciphertext. Lines and columns are 1-based.</p>
 */
@Slf4j
@Component
public class SnakeYamlRawTreeLoader implements RawTreeLoader {

    static final String VAULT_TAG = "!vault";

    @Override
    public RawNode load(Path file) {
        log.debug("Loading {}", file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return compose(reader, file.toString(), file);
        } catch (IOException e) {
            throw new RawTreeLoadException(file, e.getMessage(), e);
        }
    }

    /**
     * Parse YAML text as if read from a file of the given name.
     */
    public RawNode parse(String content, String fileName) {
        return compose(new StringReader(content), fileName, Path.of(fileName));
    }

    private RawNode compose(Reader reader, String fileName, Path file) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(true);
        Yaml yaml = new Yaml(options);
        try {
            Iterator<Node> documents = yaml.composeAll(reader).iterator();
            if (!documents.hasNext()) {
                return RawScalar.of(null, Location.at(fileName, 1, 1));
            }
            Node root = documents.next();
            if (documents.hasNext()) {
                log.warn("{} holds more than one YAML document, only the first is analyzed", fileName);
            }
            return new Converter(fileName).convert(root);
        } catch (YAMLException e) {
            throw new RawTreeLoadException(file, e.getMessage(), e);
        }
    }

    /**
     * Node graph to raw tree. Aliases resolve to the same converted node.
     */
    private static final class Converter {

        private final String fileName;
        private final Map<Node, RawNode> converted = new IdentityHashMap<>();

        Converter(String fileName) {
            this.fileName = fileName;
        }

        RawNode convert(Node node) {
            RawNode done = converted.get(node);
            if (done != null) {
                return done;
            }
            Location location = location(node.getStartMark());
            RawNode result;
            if (node instanceof MappingNode mapping) {
                Map<String, RawNode> entries = new LinkedHashMap<>();
                for (NodeTuple tuple : mapping.getValue()) {
                    entries.put(keyText(tuple.getKeyNode()), convert(tuple.getValueNode()));
                }
                result = new RawMapping(entries, location);
            } else if (node instanceof SequenceNode sequence) {
                List<RawNode> items = new ArrayList<>();
                for (Node item : sequence.getValue()) {
                    items.add(convert(item));
                }
                result = new RawSequence(items, location);
            } else {
                result = scalar((ScalarNode) node, location);
            }
            converted.put(node, result);
            return result;
        }

        private String keyText(Node key) {
            if (key instanceof ScalarNode scalar) {
                return scalar.getValue();
            }
            return String.valueOf(convert(key).toPlainValue());
        }

        private Location location(Mark mark) {
            if (mark == null) {
                return Location.at(fileName, 0, 0);
            }
            return Location.at(fileName, mark.getLine() + 1, mark.getColumn() + 1);
        }

        private static RawScalar scalar(ScalarNode node, Location location) {
            Tag tag = node.getTag();
            String text = node.getValue();
            if (VAULT_TAG.equals(tag.getValue())) {
                return RawScalar.vault(text, location);
            }
            if (Tag.NULL.equals(tag)) {
                return RawScalar.of(null, location);
            }
            if (Tag.BOOL.equals(tag)) {
                String lower = text.toLowerCase(Locale.ROOT);
                return RawScalar.of(lower.equals("true") || lower.equals("yes") || lower.equals("on")
                        || lower.equals("y"), location);
            }
            if (Tag.INT.equals(tag)) {
                return RawScalar.of(parseInteger(text), location);
            }
            if (Tag.FLOAT.equals(tag)) {
                return RawScalar.of(parseFloat(text), location);
            }
            return RawScalar.of(text, location);
        }

        private static Object parseInteger(String text) {
            String digits = text.replace("_", "");
            try {
                boolean negative = digits.startsWith("-");
                String unsigned = digits.startsWith("-") || digits.startsWith("+") ? digits.substring(1) : digits;
                long value;
                if (unsigned.startsWith("0x")) {
                    value = Long.parseLong(unsigned.substring(2), 16);
                } else if (unsigned.startsWith("0b")) {
                    value = Long.parseLong(unsigned.substring(2), 2);
                } else if (unsigned.length() > 1 && unsigned.startsWith("0")) {
                    value = Long.parseLong(unsigned.substring(1), 8);
                } else {
                    value = Long.parseLong(unsigned);
                }
                return negative ? -value : value;
            } catch (NumberFormatException e) {
                // sexagesimal and out-of-range values stay text
                return text;
            }
        }

        private static Object parseFloat(String text) {
            String lower = text.toLowerCase(Locale.ROOT).replace("_", "");
            switch (lower) {
                case ".inf", "+.inf":
                    return Double.POSITIVE_INFINITY;
                case "-.inf":
                    return Double.NEGATIVE_INFINITY;
                case ".nan":
                    return Double.NaN;
                default:
                    try {
                        return Double.parseDouble(lower);
                    } catch (NumberFormatException e) {
                        return text;
                    }
            }
        }
    }
}

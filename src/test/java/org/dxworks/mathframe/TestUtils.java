package org.dxworks.mathframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.mathframe.catalog.CommandCatalog;
import org.dxworks.mathframe.cursor.Cursor;
import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.VerticalDirection;
import org.dxworks.mathframe.parser.AstMaterializer;
import org.dxworks.mathframe.parser.LatexParseException;
import org.dxworks.mathframe.parser.LatexParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class TestUtils {
    public static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    /**
     * Parses {@code latex} into a fresh root block.
     */
    public static Block tree(String latex) throws LatexParseException {
        NodeIdGenerator ids = new NodeIdGenerator();
        Block root = Block.root(ids);
        Cursor cursor = new Cursor(root, ids, VerticalDirection.UP);
        new AstMaterializer(CommandCatalog.getDefault(), ids).materialize(new LatexParser().parse(latex), cursor);
        return root;
    }

    public static List<JsonNode> readJsonLines(Path file) throws IOException {
        List<JsonNode> records = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                records.add(JSON_MAPPER.readTree(line));
            }
        }
        return records;
    }
}

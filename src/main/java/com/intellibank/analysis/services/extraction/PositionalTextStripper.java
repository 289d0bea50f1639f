package com.intellibank.analysis.services.extraction;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

/**
 * Text stripper that keeps the horizontal position of every whitespace-separated token, so that
 * statement tables can be rebuilt column by column.
 */
class PositionalTextStripper extends PDFTextStripper {

    record Token(String text, float xStart, float xEnd, float charWidth) {
        float center() {
            return (xStart + xEnd) / 2f;
        }
    }

    private final List<List<Token>> lines = new ArrayList<>();
    private List<Token> current = new ArrayList<>();

    PositionalTextStripper() throws IOException {
        super();
        setSortByPosition(true);
    }

    /**
     * Returns the visual lines of the document in reading order, pages concatenated.
     */
    List<List<Token>> readLines(PDDocument document) throws IOException {
        lines.clear();
        current = new ArrayList<>();
        getText(document);
        flushLine();
        return new ArrayList<>(lines);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (textPositions == null || textPositions.isEmpty()) return;

        StringBuilder word = new StringBuilder();
        float start = 0f;
        float end = 0f;
        int glyphs = 0;
        for (TextPosition p : textPositions) {
            String unicode = p.getUnicode();
            if (unicode == null || unicode.isBlank()) {
                addToken(word, start, end, glyphs);
                word.setLength(0);
                glyphs = 0;
                continue;
            }
            if (glyphs == 0) start = p.getXDirAdj();
            word.append(unicode);
            end = p.getXDirAdj() + p.getWidthDirAdj();
            glyphs++;
        }
        addToken(word, start, end, glyphs);
    }

    @Override
    protected void writeLineSeparator() throws IOException {
        flushLine();
        super.writeLineSeparator();
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
        flushLine();
        super.endPage(page);
    }

    private void addToken(StringBuilder word, float start, float end, int glyphs) {
        if (glyphs == 0 || word.length() == 0) return;
        float width = Math.max(end - start, 0.1f);
        current.add(new Token(word.toString(), start, end, width / glyphs));
    }

    private void flushLine() {
        if (!current.isEmpty()) {
            current.sort((a, b) -> Float.compare(a.xStart(), b.xStart()));
            lines.add(current);
            current = new ArrayList<>();
        }
    }
}

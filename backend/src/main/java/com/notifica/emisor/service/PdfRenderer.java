package com.notifica.emisor.service;

import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.io.image.ImageData;
import com.itextpdf.io.image.ImageDataFactory;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.canvas.PdfCanvas;
import com.itextpdf.layout.Canvas;
import com.itextpdf.layout.element.Image;
import com.notifica.emisor.model.BarcodeImage;
import com.notifica.emisor.model.FieldMapping;
import com.notifica.emisor.model.PageDimensions;
import com.notifica.emisor.util.FittedText;
import com.notifica.emisor.util.TextFitter;
import com.notifica.emisor.util.TextFormatter;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Draws one single-page notice: every mapped field at its declared box, text fitted to the box,
 * and at most one barcode image per barcode field.
 */
@Service
public class PdfRenderer {

    private final TextFormatter formatter;

    public PdfRenderer(TextFormatter formatter) {
        this.formatter = formatter;
    }

    public byte[] render(List<FieldMapping> fields, PageDimensions page, Map<String, ?> data, BarcodeImage barcode) throws IOException {
        PageDimensions dims = page != null ? page : PageDimensions.DEFAULT;
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (PdfDocument pdf = new PdfDocument(new PdfWriter(baos))) {
            PdfPage pdfPage = pdf.addNewPage(new PageSize(dims.widthPt(), dims.heightPt()));
            PdfCanvas canvas = new PdfCanvas(pdfPage);
            Map<String, PdfFont> fonts = new HashMap<>();
            float pageHeight = dims.heightPt();

            for (FieldMapping field : fields) {
                Box box = Box.of(field, pageHeight);
                PdfFont font = fonts.computeIfAbsent(baseFontName(field.font()), PdfRenderer::createFont);

                if (field.barcode()) {
                    if (barcode != null) {
                        drawBarcode(canvas, pdfPage, box, barcode);
                    } else {
                        drawText(canvas, font, box, field.size(), field.placeholder());
                    }
                    continue;
                }

                String key = field.padronField();
                String text = key != null && data.containsKey(key)
                        ? formatter.format(data.get(key), field.formatSpec())
                        : field.placeholder();
                drawText(canvas, font, box, field.size(), text);
            }
        }
        return baos.toByteArray();
    }

    private void drawText(PdfCanvas canvas, PdfFont font, Box box, float declaredSize, String text) {
        TextFitter fitter = new TextFitter(font::getWidth);
        FittedText fitted = fitter.fit(text, box.width, box.height, declaredSize);
        float size = fitted.fontSize();

        if (fitted.isSingleLine()) {
            String line = fitted.lines().get(0);
            float ascent = font.getAscent(line, size);
            float descent = font.getDescent(line, size);
            float baseline = box.top - box.height / 2f - (ascent + descent) / 2f;
            showLine(canvas, font, size, box.x, baseline, line);
            return;
        }

        float baseline = box.top - size;
        for (String line : fitted.lines()) {
            showLine(canvas, font, size, box.x, baseline, line);
            baseline -= fitted.lineHeight();
        }
    }

    private static void showLine(PdfCanvas canvas, PdfFont font, float size, float x, float y, String line) {
        canvas.beginText()
                .setFontAndSize(font, size)
                .moveText(x, y)
                .showText(line)
                .endText();
    }

    private static void drawBarcode(PdfCanvas pdfCanvas, PdfPage page, Box box, BarcodeImage barcode) {
        ImageData data = ImageDataFactory.create(barcode.png());
        float scale = Math.min(box.width / barcode.widthPt(), box.height / barcode.heightPt());
        float w = barcode.widthPt() * scale;
        float h = barcode.heightPt() * scale;
        float x = box.x + (box.width - w) / 2f;
        float y = box.bottom() + (box.height - h) / 2f;
        Canvas canvas = new Canvas(pdfCanvas, page.getPageSize());
        canvas.add(new Image(data).scaleAbsolute(w, h).setFixedPosition(x, y));
        canvas.close();
    }

    /** Maps a declared font name onto one of the standard Type1 families. */
    static String baseFontName(String declared) {
        String f = declared == null ? "" : declared.toLowerCase(Locale.ROOT).replace(" ", "").replace("-", "");
        boolean bold = f.contains("bold") || f.contains("negrita");
        boolean italic = f.contains("italic") || f.contains("oblique") || f.contains("cursiva");
        if (f.contains("times")) {
            if (bold && italic) return StandardFonts.TIMES_BOLDITALIC;
            if (bold) return StandardFonts.TIMES_BOLD;
            if (italic) return StandardFonts.TIMES_ITALIC;
            return StandardFonts.TIMES_ROMAN;
        }
        if (f.contains("courier")) {
            if (bold && italic) return StandardFonts.COURIER_BOLDOBLIQUE;
            if (bold) return StandardFonts.COURIER_BOLD;
            if (italic) return StandardFonts.COURIER_OBLIQUE;
            return StandardFonts.COURIER;
        }
        // Arial and anything unknown
        if (bold && italic) return StandardFonts.HELVETICA_BOLDOBLIQUE;
        if (bold) return StandardFonts.HELVETICA_BOLD;
        if (italic) return StandardFonts.HELVETICA_OBLIQUE;
        return StandardFonts.HELVETICA;
    }

    private static PdfFont createFont(String baseFont) {
        try {
            return PdfFontFactory.createFont(baseFont);
        } catch (IOException e) {
            throw new IllegalStateException("Standard font unavailable: " + baseFont, e);
        }
    }

    /** Field box in PDF points with a bottom-left origin. */
    private record Box(float x, float top, float width, float height) {
        static Box of(FieldMapping f, float pageHeight) {
            float x = PageDimensions.toPoints(f.x());
            float top = pageHeight - PageDimensions.toPoints(f.y());
            return new Box(x, top, PageDimensions.toPoints(f.width()), PageDimensions.toPoints(f.height()));
        }

        float bottom() { return top - height; }
    }
}

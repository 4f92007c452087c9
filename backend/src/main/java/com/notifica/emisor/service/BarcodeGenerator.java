package com.notifica.emisor.service;

import com.itextpdf.barcodes.Barcode128;
import com.itextpdf.barcodes.Barcode1D;
import com.itextpdf.barcodes.Barcode39;
import com.itextpdf.barcodes.BarcodeEAN;
import com.itextpdf.barcodes.BarcodeInter25;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.notifica.emisor.model.BarcodeImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Image;
import java.awt.image.BufferedImage;
import java.awt.image.PixelGrabber;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rasterizes barcode payloads to PNG. iText computes the bar pattern; this class lays it out
 * on a pixel grid with a fixed module width, bar height and quiet zone.
 */
@Service
public class BarcodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(BarcodeGenerator.class);

    public static final String CODE128 = "code128";
    public static final String CODE39 = "code39";
    public static final String EAN13 = "ean13";
    public static final String EAN8 = "ean8";
    public static final String ITF = "itf";

    static final double MODULE_WIDTH_MM = 0.2;
    static final double BAR_HEIGHT_MM = 15.0;
    static final double QUIET_ZONE_MM = 6.5;
    private static final double MM_PER_INCH = 25.4;

    private static final Pattern CODE39_CHARS = Pattern.compile("^[A-Z0-9 \\-.$/+%]{1,43}$");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");

    private final int dpi;

    public BarcodeGenerator(@Value("${emisor.barcode.dpi:300}") int dpi) {
        this.dpi = dpi > 0 ? dpi : 300;
    }

    public BarcodeImage render(String payload) {
        return render(payload, CODE128);
    }

    /**
     * Renders the payload in the requested symbology. An unknown symbology, or a payload it cannot
     * carry, falls back to Code128.
     *
     * @throws BarcodeException when the payload is not encodable as Code128 either
     */
    public BarcodeImage render(String payload, String symbology) {
        String requested = symbology == null ? CODE128 : symbology.trim().toLowerCase(Locale.ROOT).replace("-", "");
        String effective = requested;
        if (!canEncode(requested, payload)) {
            if (!CODE128.equals(requested)) {
                log.debug("[Barcode] payload not valid for {}, falling back to code128", requested);
            }
            effective = CODE128;
            if (!canEncode(CODE128, payload)) {
                throw new BarcodeException("Payload cannot be encoded as Code128: " + describe(payload));
            }
        }
        String code = EAN13.equals(effective) || EAN8.equals(effective) ? withEanCheckDigit(effective, payload) : payload;
        boolean[] modules = modulePattern(effective, code);
        return rasterize(modules, effective);
    }

    static boolean canEncode(String symbology, String payload) {
        if (payload == null || payload.isEmpty()) return false;
        switch (symbology) {
            case CODE128:
                if (payload.length() > 255) return false;
                for (int i = 0; i < payload.length(); i++) {
                    char c = payload.charAt(i);
                    if (c < 32 || c > 126) return false;
                }
                return true;
            case CODE39:
                return CODE39_CHARS.matcher(payload).matches();
            case EAN13:
                return DIGITS.matcher(payload).matches()
                        && (payload.length() == 12 || (payload.length() == 13 && eanCheckDigit(payload.substring(0, 12)) == payload.charAt(12) - '0'));
            case EAN8:
                return DIGITS.matcher(payload).matches()
                        && (payload.length() == 7 || (payload.length() == 8 && eanCheckDigit(payload.substring(0, 7)) == payload.charAt(7) - '0'));
            case ITF:
                return DIGITS.matcher(payload).matches() && payload.length() % 2 == 0;
            default:
                return false;
        }
    }

    static int eanCheckDigit(String body) {
        int sum = 0;
        for (int i = 0; i < body.length(); i++) {
            int d = body.charAt(body.length() - 1 - i) - '0';
            sum += (i % 2 == 0) ? d * 3 : d;
        }
        return (10 - sum % 10) % 10;
    }

    private static String withEanCheckDigit(String symbology, String payload) {
        int bodyLength = EAN13.equals(symbology) ? 12 : 7;
        return payload.length() == bodyLength ? payload + eanCheckDigit(payload) : payload;
    }

    /** One entry per narrow module, true for a dark bar. */
    private boolean[] modulePattern(String symbology, String code) {
        try (PdfDocument scratch = new PdfDocument(new PdfWriter(new ByteArrayOutputStream()))) {
            scratch.addNewPage();
            Barcode1D barcode = create(symbology, scratch);
            barcode.setCode(code);
            Image awt = barcode.createAwtImage(Color.BLACK, Color.WHITE);
            PixelGrabber grabber = new PixelGrabber(awt, 0, 0, -1, 1, true);
            if (!grabber.grabPixels()) {
                throw new BarcodeException("Bar pattern could not be read for " + symbology);
            }
            int[] pixels = (int[]) grabber.getPixels();
            int width = grabber.getWidth();
            boolean[] modules = new boolean[width];
            for (int x = 0; x < width; x++) {
                int rgb = pixels[x] & 0xFFFFFF;
                modules[x] = rgb == 0;
            }
            return modules;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BarcodeException("Interrupted while rendering barcode", e);
        }
    }

    private static Barcode1D create(String symbology, PdfDocument doc) {
        switch (symbology) {
            case CODE39: {
                Barcode39 b = new Barcode39(doc);
                b.setStartStopText(false);
                return b;
            }
            case EAN13: {
                BarcodeEAN b = new BarcodeEAN(doc);
                b.setCodeType(BarcodeEAN.EAN13);
                return b;
            }
            case EAN8: {
                BarcodeEAN b = new BarcodeEAN(doc);
                b.setCodeType(BarcodeEAN.EAN8);
                return b;
            }
            case ITF: {
                BarcodeInter25 b = new BarcodeInter25(doc);
                b.setGenerateChecksum(false);
                return b;
            }
            default: {
                Barcode128 b = new Barcode128(doc);
                b.setCodeType(Barcode128.CODE128);
                return b;
            }
        }
    }

    private BarcodeImage rasterize(boolean[] modules, String symbology) {
        double pxPerMm = dpi / MM_PER_INCH;
        double modulePx = MODULE_WIDTH_MM * pxPerMm;
        int quietPx = (int) Math.round(QUIET_ZONE_MM * pxPerMm);
        int barsPx = (int) Math.round(modules.length * modulePx);
        int width = barsPx + 2 * quietPx;
        int height = (int) Math.round(BAR_HEIGHT_MM * pxPerMm);

        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_BINARY);
        Graphics2D g = img.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.setColor(Color.BLACK);
            for (int i = 0; i < modules.length; i++) {
                if (!modules[i]) continue;
                int x0 = quietPx + (int) Math.round(i * modulePx);
                int x1 = quietPx + (int) Math.round((i + 1) * modulePx);
                g.fillRect(x0, 0, Math.max(1, x1 - x0), height);
            }
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(img, "png", out);
        } catch (IOException e) {
            throw new BarcodeException("PNG encoding failed", e);
        }
        return new BarcodeImage(out.toByteArray(), width, height, dpi, symbology);
    }

    private static String describe(String payload) {
        if (payload == null) return "null";
        return payload.length() > 40 ? payload.substring(0, 40) + "..." : payload;
    }
}

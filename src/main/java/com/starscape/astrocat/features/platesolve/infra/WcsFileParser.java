package com.starscape.astrocat.features.platesolve.infra;

import com.starscape.astrocat.features.platesolve.domain.PlateSolverException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads the primary header of a solver WCS file into a JSON-friendly map of card values.
 * Commentary cards are dropped.
 */
@Component
public class WcsFileParser {

    private static final Set<String> SKIPPED_KEYS = Set.of("HISTORY", "COMMENT", "ExifOffset", "END");

    public Map<String, Object> parse(byte[] fitsBytes) {
        try (Fits fits = new Fits(new ByteArrayInputStream(fitsBytes))) {
            BasicHDU<?> hdu = fits.readHDU();
            if (hdu == null) {
                throw new PlateSolverException("WCS file contains no header", false);
            }
            return toMap(hdu.getHeader());
        } catch (FitsException | IOException e) {
            throw new PlateSolverException("Unreadable WCS file: " + e.getMessage(), false, e);
        }
    }

    private Map<String, Object> toMap(Header header) {
        Map<String, Object> values = new LinkedHashMap<>();
        Cursor<String, HeaderCard> cursor = header.iterator();
        while (cursor.hasNext()) {
            HeaderCard card = cursor.next();
            String key = card.getKey();
            if (key == null || key.isBlank() || SKIPPED_KEYS.contains(key) || !card.isKeyValuePair()) {
                continue;
            }
            values.put(key, valueOf(card));
        }
        return values;
    }

    private Object valueOf(HeaderCard card) {
        Class<?> type = card.valueType();
        if (Boolean.class.equals(type)) {
            return card.getValue(Boolean.class, null);
        }
        if (Integer.class.equals(type) || Long.class.equals(type)) {
            return card.getValue(Long.class, null);
        }
        if (type != null && Number.class.isAssignableFrom(type)) {
            return card.getValue(Double.class, null);
        }
        return card.getValue();
    }
}

package org.tapeshift.converter.frontend.header;

import org.tapeshift.converter.api.ConversionErrorCode;
import org.tapeshift.converter.api.ConversionException;
import org.tapeshift.converter.model.MachineType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the first line of a table and selects the tape model it was written for.
 * <p>
 * The header is matched before comment stripping, since both headers start with the
 * comment delimiter.
 */
public class HeaderResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(HeaderResolver.class);

    /**
     * Resolves the machine type from the header line.
     *
     * @param headerLine The first line of the file, or {@code null} if the file is empty.
     * @return The selected machine type.
     * @throws ConversionException if the file is empty or the header is not recognized.
     */
    public MachineType resolve(String headerLine) throws ConversionException {
        if (headerLine == null) {
            throw new ConversionException(ConversionErrorCode.EMPTY_FILE,
                    "Invalid machine type header: File is empty", "");
        }
        final String header = headerLine.strip();
        final MachineType type = MachineType.fromHeader(header)
                .orElseThrow(() -> new ConversionException(ConversionErrorCode.INVALID_HEADER,
                        "Invalid machine type header: " + headerLine, headerLine));
        LOGGER.debug("Header '{}' selects the {} source model", header, type.displayName());
        return type;
    }
}

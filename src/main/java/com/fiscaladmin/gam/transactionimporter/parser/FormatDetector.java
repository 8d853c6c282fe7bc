package com.fiscaladmin.gam.transactionimporter.parser;

import com.fiscaladmin.gam.transactionimporter.mapping.BankProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects which bank profile a statement file belongs to by inspecting its header row.
 * <p>
 * Detection logic (applied after BOM stripping, quote removal, whitespace collapsing
 * and lowercasing of each header cell):
 * <ul>
 *   <li>Profiles are tried in the order given; the first whose header signature
 *       columns are all present wins. Column order and extra columns are ignored</li>
 *   <li>Unsupported extension, empty file, or no matching profile → an
 *       unrecognised {@link DetectionResult}; detection never throws for these</li>
 * </ul>
 * Detection has no side effects.
 */
public class FormatDetector {

    private static final Logger LOG = LoggerFactory.getLogger(FormatDetector.class);

    private FormatDetector() {
        // utility class
    }

    /**
     * Detects the bank profile of a statement file.
     *
     * @param file     the file to inspect
     * @param profiles candidate profiles, most specific first
     * @return the detection result
     * @throws IOException if the file exists with a supported extension but cannot be read
     */
    public static DetectionResult detect(Path file, List<BankProfile> profiles) throws IOException {
        if (!SourceKind.of(file).isPresent()) {
            return DetectionResult.unrecognised(null, "Unsupported file type: " + file.getFileName());
        }

        List<String> header = StatementReader.readHeader(file);
        if (header.isEmpty()) {
            return DetectionResult.unrecognised(null, "Unrecognised format: (empty file)");
        }

        String headerLine = String.join(",", header);
        DetectionResult result = detect(header, profiles);
        if (result.isRecognised()) {
            LOG.info("Detected profile {} for {}", result.getProfile().get().getId(), file.getFileName());
        } else {
            LOG.warn("No profile matches {}. Header: {}", file.getFileName(), headerLine);
        }
        return result;
    }

    /**
     * Matches an already-read header row against the profiles.
     */
    public static DetectionResult detect(List<String> header, List<BankProfile> profiles) {
        String headerLine = String.join(",", header);
        Set<String> keys = new HashSet<>(HeaderNames.normalizeAll(header));
        for (BankProfile profile : profiles) {
            if (profile.matchesHeader(keys)) {
                return DetectionResult.recognised(profile, headerLine);
            }
        }
        return DetectionResult.unrecognised(headerLine, "Unrecognised format. Header: " + headerLine);
    }
}

package com.dataops.loader.service;

import com.dataops.loader.exception.UnknownTargetTableException;
import com.dataops.loader.model.SourceFile;
import com.dataops.loader.model.TargetTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Picks the target table of a source file: the name configured on the file,
 * or the configured target whose indicator keywords best match the header.
 */
@Component
public class TargetTableResolver {

    private static final Logger logger = LoggerFactory.getLogger(TargetTableResolver.class);

    private final TargetTableRegistry registry;

    public TargetTableResolver(TargetTableRegistry registry) {
        this.registry = registry;
    }

    public TargetTable resolve(SourceFile sourceFile, List<String> header) {
        if (sourceFile.getTargetName() != null && !sourceFile.getTargetName().isBlank()) {
            return registry.get(sourceFile.getTargetName().trim());
        }
        return detect(header);
    }

    /**
     * Score each target by the number of header fields containing one of its indicators.
     * A single best score wins; a tie or no match at all is an error.
     */
    public TargetTable detect(List<String> header) {
        TargetTable best = null;
        int bestScore = 0;
        boolean tied = false;

        for (TargetTable target : registry.getAll()) {
            int score = score(target, header);
            logger.debug("Target {} scored {} against header {}", target.getName(), score, header);
            if (score > bestScore) {
                best = target;
                bestScore = score;
                tied = false;
            } else if (score == bestScore && score > 0) {
                tied = true;
            }
        }

        if (best == null) {
            throw new UnknownTargetTableException("Could not detect target table from header " + header);
        }
        if (tied) {
            throw new UnknownTargetTableException(
                    "Header " + header + " matches more than one target table equally well");
        }
        logger.info("Detected target table {} (score {})", best.getName(), bestScore);
        return best;
    }

    private int score(TargetTable target, List<String> header) {
        int score = 0;
        for (String field : header) {
            String lower = field.toLowerCase(Locale.ROOT);
            for (String indicator : target.getIndicators()) {
                if (lower.contains(indicator)) {
                    score++;
                    break;
                }
            }
        }
        return score;
    }
}

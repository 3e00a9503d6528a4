package dev.pagecraft.service;

import dev.pagecraft.exception.ValidationException;
import dev.pagecraft.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Issues and parses the opaque ids of pages and components.
 *
 * <p>Ids travel as decimal strings in responses; {@link #fromString(String)}
 * turns them back into the numeric form the engine indexes by.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdService {

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }

    /**
     * @throws ValidationException if the value is blank or not a decimal long
     */
    public long fromString(String idString) {
        if (idString == null || idString.isBlank()) {
            throw new ValidationException("Id must not be blank");
        }
        try {
            return Long.parseLong(idString.trim());
        } catch (NumberFormatException e) {
            log.debug("Rejected malformed id '{}'", idString);
            throw new ValidationException("Invalid id: " + idString);
        }
    }
}

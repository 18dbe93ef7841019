package com.autobudget.directory;

import com.autobudget.config.AutoBudgetConfig;
import com.autobudget.engine.ChannelIndex;
import com.autobudget.exception.DirectoryLoadException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Channel directory loaded from a spreadsheet CSV export.
 *
 * <p>The sheet has free-form rows above its table. The header row is the first row with a
 * cell equal to {@code name}; the {@code cookie} column of the same row holds the credential.
 * Rows with a blank name or a blank cookie are ignored, and the first row for a name wins.
 *
 * <p>A failed reload keeps the previous contents.
 */
@Component
public class SheetChannelDirectory implements ChannelDirectory {

    private static final Logger log = LoggerFactory.getLogger(SheetChannelDirectory.class);

    static final String NAME_COLUMN = "name";
    static final String COOKIE_COLUMN = "cookie";

    private final RestTemplate restTemplate;
    private final AutoBudgetConfig autoBudgetConfig;
    private final Clock clock;
    private final CsvMapper csvMapper = new CsvMapper();

    private volatile Map<String, String> credentials = Collections.emptyMap();
    private volatile long loadedAtEpochMs;

    public SheetChannelDirectory(
            @Qualifier("directoryRestTemplate") RestTemplate restTemplate, AutoBudgetConfig autoBudgetConfig, Clock clock) {
        this.restTemplate = restTemplate;
        this.autoBudgetConfig = autoBudgetConfig;
        this.clock = clock;
    }

    @Override
    public Optional<String> credentialFor(String channel) {
        String key = ChannelIndex.normalize(channel);
        return key == null ? Optional.empty() : Optional.ofNullable(credentials.get(key));
    }

    @Override
    public void refreshIfStale() {
        String sheetUrl = autoBudgetConfig.getDirectory().getSheetUrl();
        if (sheetUrl == null || sheetUrl.isBlank()) {
            return;
        }
        long now = clock.millis();
        if (loadedAtEpochMs > 0
                && now - loadedAtEpochMs < autoBudgetConfig.getDirectory().getRefreshInterval().toMillis()) {
            return;
        }
        try {
            credentials = load(sheetUrl);
            loadedAtEpochMs = now;
            log.info("Loaded {} channels from the channel sheet", credentials.size());
        } catch (DirectoryLoadException e) {
            log.error("Channel directory refresh failed, keeping {} channels: {}", credentials.size(), e.getMessage());
        }
    }

    @Override
    public int size() {
        return credentials.size();
    }

    Map<String, String> load(String sheetUrl) {
        String csv;
        try {
            csv = restTemplate.getForObject(URI.create(sheetUrl), String.class);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new DirectoryLoadException("Channel sheet download failed: " + e.getMessage(), e);
        }
        if (csv == null || csv.isBlank()) {
            throw new DirectoryLoadException("Channel sheet export is empty");
        }
        return parse(csv);
    }

    Map<String, String> parse(String csv) {
        Map<String, String> parsed = new HashMap<>();
        int nameCol = -1;
        int cookieCol = -1;
        try (MappingIterator<List<String>> rows =
                csvMapper.readerForListOf(String.class).with(CsvParser.Feature.WRAP_AS_ARRAY).readValues(csv)) {
            while (rows.hasNextValue()) {
                List<String> row = rows.nextValue();
                if (nameCol < 0) {
                    nameCol = indexOf(row, NAME_COLUMN);
                    cookieCol = indexOf(row, COOKIE_COLUMN);
                    continue;
                }
                String name = ChannelIndex.normalize(cell(row, nameCol));
                String cookie = cell(row, cookieCol);
                if (name != null && cookie != null && !cookie.isBlank()) {
                    parsed.putIfAbsent(name, cookie.trim());
                }
            }
        } catch (IOException e) {
            throw new DirectoryLoadException("Channel sheet is not readable CSV", e);
        }
        if (nameCol < 0) {
            throw new DirectoryLoadException("Column \"" + NAME_COLUMN + "\" not found in channel sheet");
        }
        return parsed;
    }

    private static int indexOf(List<String> row, String header) {
        for (int i = 0; i < row.size(); i++) {
            if (row.get(i) != null && header.equals(row.get(i).trim())) {
                return i;
            }
        }
        return -1;
    }

    private static String cell(List<String> row, int index) {
        return index >= 0 && index < row.size() ? row.get(index) : null;
    }
}

package org.bacteria.service;

import lombok.RequiredArgsConstructor;
import org.bacteria.configuration.QueryProperties;
import org.bacteria.models.dto.BacteriaPage;
import org.bacteria.models.dto.DatasetStats;
import org.bacteria.models.dto.SearchResult;
import org.bacteria.models.record.NormalizedRecord;
import org.bacteria.repository.BacteriaRepository;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

@Service
@RequiredArgsConstructor
public class BacteriaQueryService {

    private static final int DEFAULT_PAGE = 1;

    private final BacteriaRepository bacteriaRepository;
    private final QueryProperties queryProperties;

    /**
     * One-based page of the dataset. Missing or non-positive {@code page}/{@code limit} fall back
     * to page 1 and the configured default limit.
     */
    public BacteriaPage getPage(Integer page, Integer limit) {
        int resolvedPage = page == null || page < 1 ? DEFAULT_PAGE : page;
        int resolvedLimit = limit == null || limit < 1 ? queryProperties.defaultLimit() : limit;
        List<NormalizedRecord> all = bacteriaRepository.findAll();

        long start = (long) (resolvedPage - 1) * resolvedLimit;
        List<NormalizedRecord> data = start >= all.size()
                ? List.of()
                : all.subList((int) start, (int) Math.min(start + resolvedLimit, all.size()));
        return new BacteriaPage(all.size(), resolvedPage, resolvedLimit, data);
    }

    public Optional<NormalizedRecord> findById(String identifier) {
        return bacteriaRepository.findById(identifier);
    }

    /**
     * Case-insensitive substring match on genus and species; a blank filter is ignored.
     */
    public SearchResult search(String genus, String species) {
        Stream<NormalizedRecord> results = bacteriaRepository.findAll().stream();
        if (StringUtils.hasLength(genus)) {
            results = results.filter(matches(NormalizedRecord::genus, genus));
        }
        if (StringUtils.hasLength(species)) {
            results = results.filter(matches(NormalizedRecord::species, species));
        }
        List<NormalizedRecord> matched = results.toList();
        List<NormalizedRecord> capped = matched.subList(0, Math.min(matched.size(), queryProperties.searchLimit()));
        return new SearchResult(matched.size(), capped);
    }

    /**
     * Distinct counts treat a missing genus or species as one more value.
     */
    public DatasetStats getStats() {
        List<NormalizedRecord> all = bacteriaRepository.findAll();
        Set<String> genera = new HashSet<>();
        Set<String> species = new HashSet<>();
        for (NormalizedRecord record : all) {
            genera.add(record.genus());
            species.add(record.species());
        }
        return new DatasetStats(all.size(), genera.size(), species.size());
    }

    private static Predicate<NormalizedRecord> matches(Function<NormalizedRecord, String> field, String filter) {
        String needle = filter.toLowerCase(Locale.ROOT);
        return record -> {
            String value = field.apply(record);
            return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
        };
    }
}

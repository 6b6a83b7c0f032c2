package com.peopleanalytics.importjob.parser;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record ImportTable(List<String> headers, List<ImportRow> rows) {

    public Set<String> headerSet() {
        return new LinkedHashSet<>(headers);
    }
}

package com.peopleanalytics.search;

public record ReindexResult(int indexed, int failed) {
}

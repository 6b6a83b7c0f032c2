package com.peopleanalytics.notification;

/**
 * Told once about every import job that reaches a terminal state. Implementations must not
 * throw; delivery problems are theirs to log.
 */
public interface ImportNotifier {

    void notify(ImportJobEvent event);
}

package com.maascheduler.core.model;

import java.util.List;

/**
 * Notifications fired after a run finishes.
 *
 * @param notifyOnSuccess  push a notification when the run succeeded
 * @param notifyOnFailure  push a notification when the run failed
 * @param pushTitle        custom push title, or {@code null} for the default
 * @param pushContent      custom push content, or {@code null} for the default
 * @param keywords         substrings searched for in the captured output
 * @param keywordTitle     title template; {@code {keywords}} is replaced by the matches
 * @param keywordContent   content template; {@code {keywords}} is replaced by the matches
 * @param keywordTag       notification tag for keyword matches
 */
public record PostRunHooks(
        boolean notifyOnSuccess,
        boolean notifyOnFailure,
        String pushTitle,
        String pushContent,
        List<String> keywords,
        String keywordTitle,
        String keywordContent,
        String keywordTag
) {

    public PostRunHooks {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        keywordTitle = keywordTitle == null || keywordTitle.isBlank() ? "Keywords matched: {keywords}" : keywordTitle;
        keywordContent = keywordContent == null || keywordContent.isBlank()
                ? "Task output contained: {keywords}" : keywordContent;
        keywordTag = keywordTag == null || keywordTag.isBlank() ? "log-keyword" : keywordTag;
    }

    public static PostRunHooks none() {
        return new PostRunHooks(false, false, null, null, List.of(), null, null, null);
    }
}

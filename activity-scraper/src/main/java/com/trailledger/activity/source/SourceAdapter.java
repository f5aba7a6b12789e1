package com.trailledger.activity.source;

import java.util.List;

/**
 * Reads normalised snapshots from the club web site.
 *
 * An adapter holds one navigable browser session and handles one page at a
 * time; it must not be shared between concurrent callers. Failures are
 * reported as {@link RetryableScrapeException}, {@link PageFormatException}
 * or {@link MissingContentException}.
 */
public interface SourceAdapter extends AutoCloseable {

    SourceSession login(String userName, String password);

    /** Profile of the logged-in user. */
    ProfileSnapshot fetchCurrentProfile();

    ProfileSnapshot fetchProfile(String profileUrl);

    /** The member's activity list, in page order. */
    List<ActivityStub> fetchMemberActivityStubs(String profileUrl);

    ActivitySnapshot fetchActivityDetail(String activityUrl);

    /** Releases the browser session. */
    @Override
    void close();
}

package com.github.alvarosanchez.rpmrepo.provider;

import com.github.alvarosanchez.rpmrepo.model.ReleaseDescriptor;
import com.github.alvarosanchez.rpmrepo.model.RepoConfig;

/**
 * Upstream source of releases for one repository.
 */
public interface Provider {

    /**
     * Returns the provider id used in store keys and repository paths.
     *
     * @return provider id
     */
    String id();

    /**
     * Returns repository presentation settings.
     *
     * @return repository configuration
     */
    RepoConfig repoConfig();

    /**
     * Asks the upstream for its latest release.
     *
     * @return latest release, not yet stamped with a discovery time
     * @throws com.github.alvarosanchez.rpmrepo.exception.FetchFailedException when the upstream cannot be queried
     */
    ReleaseDescriptor fetchLatestVersion();
}

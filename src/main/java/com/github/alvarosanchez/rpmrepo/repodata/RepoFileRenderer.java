package com.github.alvarosanchez.rpmrepo.repodata;

import com.github.alvarosanchez.rpmrepo.model.RepoConfig;

/**
 * Renders the yum {@code .repo} file that points package managers at a provider repository.
 */
public final class RepoFileRenderer {

    private RepoFileRenderer() {
    }

    /**
     * Renders a {@code .repo} section.
     *
     * @param repoConfig repository settings of the provider
     * @param baseUrl public base URL, without trailing slash
     * @return file content
     */
    public static String render(RepoConfig repoConfig, String baseUrl) {
        return "[" + repoConfig.name() + "]\n"
            + "name=" + repoConfig.displayName() + "\n"
            + "baseurl=" + baseUrl + "/" + repoConfig.name() + "\n"
            + "enabled=1\n"
            + "gpgcheck=0\n"
            + "repo_gpgcheck=0\n"
            + "type=rpm\n";
    }

    /**
     * Renders the shell commands that install the repository and its package.
     *
     * @param repoConfig repository settings of the provider
     * @param baseUrl public base URL, without trailing slash
     * @return install commands, one per line
     */
    public static String installHint(RepoConfig repoConfig, String baseUrl) {
        String name = repoConfig.name();
        return "sudo curl -o /etc/yum.repos.d/" + name + ".repo " + baseUrl + "/" + name + "/" + name + ".repo\n"
            + "sudo dnf install " + name + "\n";
    }
}

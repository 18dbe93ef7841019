package com.autobudget.directory;

import java.util.Collection;
import java.util.Optional;

/** Maps a channel name to the credential used for remote ads API calls. Lookups ignore case. */
public interface ChannelDirectory {

    Optional<String> credentialFor(String channel);

    /** Credential of the first channel, in iteration order, that has one. */
    default Optional<String> firstCredentialFor(Collection<String> channels) {
        for (String channel : channels) {
            Optional<String> credential = credentialFor(channel);
            if (credential.isPresent()) {
                return credential;
            }
        }
        return Optional.empty();
    }

    /** Reloads the directory when its contents are older than the refresh interval. */
    void refreshIfStale();

    int size();
}

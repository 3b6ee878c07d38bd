package com.landfall.runcommand.credential;

/**
 * Supplies the bearer credential the command channel authenticates with.
 * Constructed once and injected into the channel.
 */
public interface CredentialProvider {

    /**
     * @return a token valid for at least the next request
     * @throws CredentialException if no credential can be obtained
     */
    AccessToken token();
}

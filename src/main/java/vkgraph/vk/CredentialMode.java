package vkgraph.vk;

/** Which access token a call is made with. */
public enum CredentialMode {
    /** The crawling user's own token. */
    PRIMARY,
    /** The application's service token; used for lookups that need no user permissions. */
    SERVICE
}

package com.layeredcraft.cdk.constructs;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Properties for a {@link StaticSiteConstruct}.
 */
@Value.Immutable
public interface StaticSiteConstructProps {

    /** Root domain, e.g. "example.com". A Route53 hosted zone must exist for it. */
    String domainName();

    /** e.g. "www" for "www.example.com" */
    String siteSubDomain();

    /** Directory holding the built site */
    String assetPath();

    /** When present, requests to /api/* are proxied to this domain */
    Optional<String> apiDomain();

    /** Extra names added to the certificate, the distribution and DNS */
    List<String> alternateDomains();

    static ImmutableStaticSiteConstructProps.Builder builder() {
        return ImmutableStaticSiteConstructProps.builder();
    }
}

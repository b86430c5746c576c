package com.layeredcraft.cdk.constructs;

import static com.layeredcraft.cdk.utils.Kind.infof;

import com.layeredcraft.cdk.utils.ResourceNameUtils;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import software.amazon.awscdk.Duration;
import software.amazon.awscdk.RemovalPolicy;
import software.amazon.awscdk.services.certificatemanager.Certificate;
import software.amazon.awscdk.services.certificatemanager.CertificateValidation;
import software.amazon.awscdk.services.cloudfront.AddBehaviorOptions;
import software.amazon.awscdk.services.cloudfront.AllowedMethods;
import software.amazon.awscdk.services.cloudfront.BehaviorOptions;
import software.amazon.awscdk.services.cloudfront.CachePolicy;
import software.amazon.awscdk.services.cloudfront.Distribution;
import software.amazon.awscdk.services.cloudfront.ErrorResponse;
import software.amazon.awscdk.services.cloudfront.OriginProtocolPolicy;
import software.amazon.awscdk.services.cloudfront.OriginRequestPolicy;
import software.amazon.awscdk.services.cloudfront.ViewerProtocolPolicy;
import software.amazon.awscdk.services.cloudfront.origins.HttpOrigin;
import software.amazon.awscdk.services.cloudfront.origins.HttpOriginProps;
import software.amazon.awscdk.services.cloudfront.origins.S3StaticWebsiteOrigin;
import software.amazon.awscdk.services.cloudfront.origins.S3StaticWebsiteOriginProps;
import software.amazon.awscdk.services.route53.ARecord;
import software.amazon.awscdk.services.route53.HostedZone;
import software.amazon.awscdk.services.route53.HostedZoneProviderProps;
import software.amazon.awscdk.services.route53.IHostedZone;
import software.amazon.awscdk.services.route53.RecordTarget;
import software.amazon.awscdk.services.route53.targets.CloudFrontTarget;
import software.amazon.awscdk.services.s3.BlockPublicAccess;
import software.amazon.awscdk.services.s3.BlockPublicAccessOptions;
import software.amazon.awscdk.services.s3.Bucket;
import software.amazon.awscdk.services.s3.LifecycleRule;
import software.amazon.awscdk.services.s3.deployment.BucketDeployment;
import software.amazon.awscdk.services.s3.deployment.Source;
import software.constructs.Construct;

/**
 * Static website served from an S3 website bucket through CloudFront on {siteSubDomain}.{domainName}.
 *
 * Creates the bucket, a DNS validated certificate, the distribution (with an optional /api/* proxy
 * behaviour), alias A records for the site and every alternate domain, and a deployment of the site
 * assets that invalidates the distribution.
 *
 * The hosted zone is looked up, so the enclosing stack needs a concrete account and region.
 */
public class StaticSiteConstruct extends Construct {

    public static final String API_PATH_PATTERN = "/api/*";

    public final String siteDomain;
    public final Bucket siteBucket;
    public final Certificate certificate;
    public final Distribution distribution;

    public StaticSiteConstruct(
            @NotNull final Construct scope, @NotNull final String id, @NotNull StaticSiteConstructProps props) {
        super(scope, id);
        if (props.assetPath().isBlank()) {
            throw new IllegalArgumentException("assetPath is required");
        }
        this.siteDomain = ResourceNameUtils.buildSiteDomainName(props.siteSubDomain(), props.domainName());

        IHostedZone zone = HostedZone.fromLookup(
                this,
                id,
                HostedZoneProviderProps.builder().domainName(props.domainName()).build());

        this.siteBucket = Bucket.Builder.create(this, id + "-bucket")
                .bucketName(this.siteDomain)
                .websiteIndexDocument("index.html")
                .websiteErrorDocument("index.html")
                .publicReadAccess(true)
                .blockPublicAccess(new BlockPublicAccess(BlockPublicAccessOptions.builder()
                        .blockPublicPolicy(false)
                        .blockPublicAcls(false)
                        .ignorePublicAcls(false)
                        .restrictPublicBuckets(false)
                        .build()))
                .removalPolicy(RemovalPolicy.DESTROY)
                .autoDeleteObjects(true)
                .versioned(false)
                .lifecycleRules(List.of(LifecycleRule.builder()
                        .enabled(true)
                        .noncurrentVersionExpiration(Duration.days(1))
                        .build()))
                .build();

        var certificateBuilder = Certificate.Builder.create(this, id + "-certificate")
                .domainName(this.siteDomain)
                .validation(CertificateValidation.fromDns(zone));
        if (!props.alternateDomains().isEmpty()) {
            certificateBuilder.subjectAlternativeNames(props.alternateDomains());
        }
        this.certificate = certificateBuilder.build();

        var domainNames = new ArrayList<String>();
        domainNames.add(this.siteDomain);
        domainNames.addAll(props.alternateDomains());

        this.distribution = Distribution.Builder.create(this, id + "-cdn")
                .domainNames(domainNames)
                .defaultBehavior(BehaviorOptions.builder()
                        .origin(new S3StaticWebsiteOrigin(
                                this.siteBucket,
                                S3StaticWebsiteOriginProps.builder()
                                        .protocolPolicy(OriginProtocolPolicy.HTTP_ONLY)
                                        .build()))
                        .allowedMethods(AllowedMethods.ALLOW_GET_HEAD)
                        .compress(true)
                        .build())
                .certificate(this.certificate)
                // Client side routes are served by the SPA entry point
                .errorResponses(List.of(ErrorResponse.builder()
                        .httpStatus(403)
                        .responseHttpStatus(200)
                        .responsePagePath("/index.html")
                        .build()))
                .build();
        infof("Created distribution for %s with domains %s", this.siteDomain, domainNames);

        var apiDomain = props.apiDomain().filter(domain -> !domain.isBlank());
        if (apiDomain.isPresent()) {
            this.distribution.addBehavior(
                    API_PATH_PATTERN,
                    new HttpOrigin(
                            apiDomain.get(),
                            HttpOriginProps.builder()
                                    .protocolPolicy(OriginProtocolPolicy.HTTPS_ONLY)
                                    .build()),
                    AddBehaviorOptions.builder()
                            .allowedMethods(AllowedMethods.ALLOW_ALL)
                            .cachePolicy(CachePolicy.CACHING_DISABLED)
                            .originRequestPolicy(OriginRequestPolicy.ALL_VIEWER_EXCEPT_HOST_HEADER)
                            .viewerProtocolPolicy(ViewerProtocolPolicy.REDIRECT_TO_HTTPS)
                            .compress(true)
                            .build());
            infof("Proxying %s on %s to %s", API_PATH_PATTERN, this.siteDomain, apiDomain.get());
        }

        ARecord.Builder.create(this, id + "-alias-record")
                .zone(zone)
                .recordName(this.siteDomain)
                .target(RecordTarget.fromAlias(new CloudFrontTarget(this.distribution)))
                .build();

        var alternateDomains = props.alternateDomains();
        for (int i = 0; i < alternateDomains.size(); i++) {
            ARecord.Builder.create(this, ResourceNameUtils.buildIndexedId(id, "alias-record", i))
                    .zone(zone)
                    .recordName(alternateDomains.get(i))
                    .target(RecordTarget.fromAlias(new CloudFrontTarget(this.distribution)))
                    .build();
        }

        BucketDeployment.Builder.create(this, id + "-deployment")
                .sources(List.of(Source.asset(props.assetPath())))
                .destinationBucket(this.siteBucket)
                .distribution(this.distribution)
                .distributionPaths(List.of("/*"))
                .memoryLimit(1024)
                .build();
        infof("StaticSite %s created for %s from %s", id, this.siteDomain, props.assetPath());
    }
}

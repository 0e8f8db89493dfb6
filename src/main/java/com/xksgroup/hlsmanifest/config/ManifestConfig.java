package com.xksgroup.hlsmanifest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.hlsmanifest.parser.JsonManifestParser;
import com.xksgroup.hlsmanifest.parser.ManifestParser;
import com.xksgroup.hlsmanifest.service.helper.AudioOnlyPredicate;
import com.xksgroup.hlsmanifest.service.helper.CodecAudioOnlyPredicate;
import com.xksgroup.hlsmanifest.service.helper.DefaultUriResolver;
import com.xksgroup.hlsmanifest.service.helper.GroupIdFunction;
import com.xksgroup.hlsmanifest.service.helper.MediaGroupWalker;
import com.xksgroup.hlsmanifest.service.helper.UriResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default collaborators of the normalization pipeline. Hosts replace any of
 * them by declaring their own bean.
 */
@Configuration
public class ManifestConfig {

    @Bean
    public ManifestProperties manifestProperties(
            @Value("${manifest.llhls:true}") boolean llhls,
            @Value("${manifest.playback-context-uri:http://localhost/}") String playbackContextUri,
            @Value("${manifest.legacy-media-group-uris:true}") boolean legacyMediaGroupUris
    ) {
        return ManifestProperties.builder()
                .llhls(llhls)
                .playbackContextUri(playbackContextUri)
                .legacyMediaGroupUris(legacyMediaGroupUris)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public UriResolver uriResolver() {
        return new DefaultUriResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public AudioOnlyPredicate audioOnlyPredicate(MediaGroupWalker mediaGroupWalker) {
        return new CodecAudioOnlyPredicate(mediaGroupWalker);
    }

    @Bean
    @ConditionalOnMissingBean
    public GroupIdFunction groupIdFunction() {
        return GroupIdFunction.DEFAULT;
    }

    @Bean
    @ConditionalOnMissingBean
    public ManifestParser manifestParser(ObjectMapper objectMapper) {
        return new JsonManifestParser(objectMapper);
    }
}

/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

public final class SerializerFactory {

    // registry documents grow new fields all the time, parsing them must not trip over unknowns
    private static final ObjectMapper FAIL_SAFE_JSON_OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE, false)
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final YAMLMapper YAML_OBJECT_MAPPER = YAMLMapper.builder().build();

    public static ObjectMapper getFailSafeJsonObjectMapper() {
        return FAIL_SAFE_JSON_OBJECT_MAPPER;
    }

    public static YAMLMapper getYamlObjectMapper() {
        return YAML_OBJECT_MAPPER;
    }

    private SerializerFactory() {
    }
}

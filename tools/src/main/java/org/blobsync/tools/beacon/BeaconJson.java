// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.beacon;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Shared Gson instance for beacon API bodies. Field names map from camel case to the API's snake case.
 */
public final class BeaconJson {
    /** Thread safe, shared by all fetch tasks. */
    public static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .disableHtmlEscaping()
            .create();

    private BeaconJson() {}
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.common.response;

/**
 * Response listener for response post-processing callback. This is necessary because query
 * execution is asynchronous and the caller is not blocked while the pipeline runs.
 *
 * @param <Response> response class
 */
public interface ResponseListener<Response> {

  /**
   * Handle successful response.
   *
   * @param response successful response
   */
  void onResponse(Response response);

  /**
   * Handle failed response.
   *
   * @param e exception captured
   */
  void onFailure(Exception e);
}

/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fleak.llmauth.lib.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/**
 * Reads a response body as UTF-8 text, failing once more than {@code maxSize} bytes have arrived.
 * Token endpoint responses are small; anything larger is treated as an error.
 */
public class LimitedSizeBodyHandler implements HttpResponse.BodyHandler<String> {

  private final int maxSize;

  public LimitedSizeBodyHandler(int maxSize) {
    this.maxSize = maxSize;
  }

  @Override
  public HttpResponse.BodySubscriber<String> apply(HttpResponse.ResponseInfo responseInfo) {
    return new LimitedSizeBodySubscriber(maxSize);
  }

  static class LimitedSizeBodySubscriber implements HttpResponse.BodySubscriber<String> {

    private final int maxSize;
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private Flow.Subscription subscription;

    LimitedSizeBodySubscriber(int maxSize) {
      this.maxSize = maxSize;
    }

    @Override
    public CompletionStage<String> getBody() {
      return result;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
      this.subscription = subscription;
      subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(List<ByteBuffer> items) {
      if (result.isDone()) {
        return;
      }
      for (ByteBuffer item : items) {
        if (buffer.size() + item.remaining() > maxSize) {
          subscription.cancel();
          result.completeExceptionally(
              new IOException("Response body exceeds max size of " + maxSize + " bytes."));
          return;
        }
        byte[] chunk = new byte[item.remaining()];
        item.get(chunk);
        // chunks may split multi-byte characters; decoded in onComplete
        buffer.write(chunk, 0, chunk.length);
      }
    }

    @Override
    public void onError(Throwable throwable) {
      result.completeExceptionally(throwable);
    }

    @Override
    public void onComplete() {
      result.complete(buffer.toString(StandardCharsets.UTF_8));
    }
  }
}

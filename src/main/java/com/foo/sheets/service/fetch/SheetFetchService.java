package com.foo.sheets.service.fetch;

import com.foo.sheets.config.SheetSourceProperties;
import com.foo.sheets.model.SheetDataset;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * 스프레드시트의 CSV 내보내기를 내려받아 {@link SheetDataset} 으로 변환한다.
 *
 * <p>호출 스레드에서 응답을 받거나 타임아웃이 날 때까지 블로킹한다. 재시도하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SheetFetchService {

  private final HttpClient httpClient;
  private final CsvTableParser csvTableParser;
  private final SheetSourceProperties properties;

  public SheetDataset fetch(String sheetId, String sheetName, String gid) {
    return fetch(sheetId, sheetName, gid, properties.getTimeoutSeconds());
  }

  public SheetDataset fetch(String sheetId, String sheetName, String gid, int timeoutSeconds) {
    String url = SheetCsvUrls.forRequest(sheetId, sheetName, gid);
    byte[] body = download(url, timeoutSeconds);
    SheetDataset dataset = csvTableParser.parse(body);
    log.info("Fetched sheet {}: {} columns, {} rows", url, dataset.columnCount(),
        dataset.rowCount());
    return dataset;
  }

  private byte[] download(String url, int timeoutSeconds) {
    HttpRequest request = HttpRequest.newBuilder(URI.create(url))
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .GET()
        .build();

    HttpResponse<byte[]> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    } catch (HttpTimeoutException e) {
      throw SheetFetchException.network("timed out", e);
    } catch (IOException e) {
      throw SheetFetchException.network(describe(e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw SheetFetchException.network("interrupted", e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw SheetFetchException.transport(status, reasonPhrase(status));
    }
    return response.body();
  }

  // JDK HttpClient 는 reason phrase 를 노출하지 않는다
  private String reasonPhrase(int status) {
    HttpStatus resolved = HttpStatus.resolve(status);
    return resolved != null ? resolved.getReasonPhrase() : "Unknown Status";
  }

  private String describe(IOException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}

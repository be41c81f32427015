package org.csits.butler.server.client;

import java.io.IOException;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 下载模型服务返回的图片。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeneratedImageFetcher {

    @Qualifier("providerRestTemplate")
    private final RestTemplate restTemplate;

    public byte[] fetch(String url) throws IOException {
        try {
            byte[] bytes = restTemplate.getForObject(URI.create(url), byte[].class);
            if (bytes == null || bytes.length == 0) {
                throw new IOException("下载的图片为空: " + url);
            }
            log.debug("下载生成图片 {} 字节", bytes.length);
            return bytes;
        } catch (RestClientException | IllegalArgumentException e) {
            throw new IOException("下载生成图片失败: " + url, e);
        }
    }
}

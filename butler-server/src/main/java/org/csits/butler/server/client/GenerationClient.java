package org.csits.butler.server.client;

/**
 * 图片生成模型服务客户端。
 */
public interface GenerationClient {

    /**
     * 根据参考图和提示词生成图片。调用失败通过返回值表达，不抛异常。
     *
     * @param image 参考图内容
     * @param prompt 提示词
     * @return 生成结果
     */
    GenerationResult generate(byte[] image, String prompt);
}

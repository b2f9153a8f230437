package com.gs.ep.cadtranslate.extract;

import com.gs.ep.cadtranslate.model.CadDocument;

import java.nio.file.Path;

/**
 * 文本提取策略接口
 *
 * 每个实现负责图纸的一个结构区域。策略内部的任何异常都必须被捕获，
 * 以 success=false 的结果返回，不得抛给调用方。
 */
public interface TextSource {

    /**
     * 获取该策略对应的提取方法
     */
    ExtractionMethod getMethod();

    /**
     * 提取文本
     *
     * @param document 已解析的图纸；原始标签策略不需要，可为 null
     * @param filePath 图纸文件路径
     * @return 提取结果
     */
    ExtractionResult extract(CadDocument document, Path filePath);
}

package com.luashroud.pipeline;

import com.luashroud.compiler.ast.TopNode;

/**
 * 混淆步骤：对整棵树做一次改写
 */
public interface Step {

    String getName();

    String getDescription();

    /**
     * 改写语法树
     *
     * @return 改写后的根节点（通常就是传入的节点）
     */
    TopNode apply(TopNode top, PipelineContext context);
}

package com.nim.gateway.model;

/**
 * 模型别名：对外模型名 → NIM 后端模型名
 */
public record ModelAlias(String publicName, String backendName) {}

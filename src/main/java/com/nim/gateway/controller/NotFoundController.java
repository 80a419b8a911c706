package com.nim.gateway.controller;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * 兜底路由：其余路径与方法一律 404，错误体由全局异常处理器统一输出
 */
@RestController
public class NotFoundController {

    @RequestMapping("/**")
    public Mono<Void> notFound() {
        return Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND));
    }
}

package com.deckflow.domain.identity.adapter.gateway;

/**
 * 身份校验端口：校验预先签发的凭证，本服务不签发凭证。
 */
public interface IIdentityGateway {

    /**
     * 校验凭证。
     *
     * @param credential 连接时携带的凭证，可带 Bearer 前缀
     * @return 用户 ID
     * @throws com.deckflow.types.exception.AppException 凭证无效时抛出，错误码 AUTH_FAILED
     */
    String verify(String credential);
}

package com.deckflow.domain.session.service;

import com.deckflow.types.enums.ErrorCodeEnum;
import com.deckflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 请求文本业务校验：非空与提示词注入检测。
 */
@Service
public class InputGuardDomainService {

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("ignore\\s+(all\\s+)?(previous|prior|above)\\s+instructions", Pattern.CASE_INSENSITIVE),
            Pattern.compile("disregard\\s+(all\\s+)?(previous|prior|above)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(reveal|print|show)\\s+(your\\s+)?system\\s+prompt", Pattern.CASE_INSENSITIVE),
            Pattern.compile("you\\s+are\\s+now\\s+(in\\s+)?(developer|dan|jailbreak)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<\\s*/?\\s*(system|assistant)\\s*>", Pattern.CASE_INSENSITIVE)
    );

    /**
     * 校验初始请求文本，返回去除首尾空白后的文本。
     */
    public String requireAcceptableRequest(String text) {
        String normalized = StringUtils.trimToNull(text);
        if (normalized == null) {
            throw new AppException(ErrorCodeEnum.VALIDATION_FAILED.getCode(), "request text must not be blank");
        }
        for (Pattern pattern : INJECTION_PATTERNS) {
            if (pattern.matcher(normalized).find()) {
                throw new AppException(ErrorCodeEnum.UNSAFE_INPUT.getCode(), ErrorCodeEnum.UNSAFE_INPUT.getDefaultMessage());
            }
        }
        return normalized;
    }
}

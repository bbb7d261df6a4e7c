package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.model.Address;
import com.ryuqq.typeguard.core.model.AdminUser;
import com.ryuqq.typeguard.core.model.ContactInfo;
import com.ryuqq.typeguard.core.model.RegularUser;
import com.ryuqq.typeguard.core.model.RoleUser;
import com.ryuqq.typeguard.core.model.User;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 좁혀진 엔티티를 비정형 문서(Map) 형태로 되돌립니다.
 *
 * <p>{@code UserShape.validateUser(toDocument(user))}는 항상 {@code user}와 같은 값을 돌려줍니다.
 * 선택 필드가 null이면 키를 생략합니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class UserDocuments {

    private UserDocuments() {
    }

    public static Map<String, Object> toDocument(User user) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(UserShape.ID, user.id());
        document.put(UserShape.NAME, user.name());
        document.put(UserShape.CONTACT, toDocument(user.contact()));
        document.put(UserShape.AGE, user.age());
        document.put(UserShape.IS_ACTIVE, user.active());
        document.put(UserShape.TAGS, new ArrayList<>(user.tags()));
        if (user.metadata() != null) {
            document.put(UserShape.METADATA, new LinkedHashMap<>(user.metadata()));
        }
        document.put(UserShape.CREATED_AT, user.createdAt());
        document.put(UserShape.UPDATED_AT, user.updatedAt());
        return document;
    }

    /**
     * 공통 사용자 필드 뒤에 role과 역할별 필드를 붙입니다.
     */
    public static Map<String, Object> toDocument(RoleUser roleUser) {
        Map<String, Object> document = toDocument(roleUser.user());
        document.put(RoleUserValidator.ROLE, roleUser.role().wireName());
        switch (roleUser.role()) {
            case ADMIN -> {
                AdminUser admin = (AdminUser) roleUser;
                document.put(AdminUserShape.PERMISSIONS, new ArrayList<>(admin.permissions()));
                if (admin.lastLogin() != null) {
                    document.put(AdminUserShape.LAST_LOGIN, admin.lastLogin());
                }
            }
            case USER -> {
                RegularUser regular = (RegularUser) roleUser;
                if (regular.subscription() != null) {
                    document.put(RegularUserShape.SUBSCRIPTION, regular.subscription().wireName());
                }
            }
        }
        return document;
    }

    public static Map<String, Object> toDocument(ContactInfo contact) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("email", contact.email());
        if (contact.phone() != null) {
            document.put("phone", contact.phone());
        }
        if (contact.address() != null) {
            document.put("address", toDocument(contact.address()));
        }
        return document;
    }

    public static Map<String, Object> toDocument(Address address) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("street", address.street());
        document.put("city", address.city());
        document.put("state", address.state());
        document.put("zipCode", address.zipCode());
        document.put("country", address.country());
        return document;
    }
}

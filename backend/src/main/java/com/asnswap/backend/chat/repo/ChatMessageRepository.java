package com.asnswap.backend.chat.repo;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.asnswap.backend.chat.domain.ChatMessage;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    // a <-> b 양방향 대화. 같은 시각이면 id 순
    @Query("""
            select m from ChatMessage m
             where (m.fromEmail = :a and m.toEmail = :b)
                or (m.fromEmail = :b and m.toEmail = :a)
             order by m.createdAt asc, m.id asc
            """)
    List<ChatMessage> findConversation(@Param("a") String a, @Param("b") String b);

    // 보낸/받은 메시지 전부 삭제 (관리자 계정 삭제용)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from ChatMessage m where m.fromEmail = :email or m.toEmail = :email")
    int deleteAllInvolving(@Param("email") String email);
}

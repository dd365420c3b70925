package com.volunteermedia.service;

import com.volunteermedia.dto.ProtocolRequest;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.Group;
import com.volunteermedia.model.Protocol;
import com.volunteermedia.repository.ProtocolRepository;
import com.volunteermedia.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * A group's ordered protocol entries. Listing is only available when the group has
 * protocols switched on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProtocolService {

    private final ProtocolRepository protocolRepository;
    private final GroupService groupService;
    private final GroupAccessService groupAccessService;

    @Transactional(readOnly = true)
    public List<Protocol> listProtocols(AuthenticatedUser user, Long groupId) {
        Group group = groupService.getActiveGroup(groupId);
        groupAccessService.requireAccess(user, groupId);
        if (!group.isHasProtocols()) {
            throw new NotFoundException("Protocols not enabled for this group");
        }
        return protocolRepository.findByGroupIdOrderByOrderIndexAscCreatedAtAsc(groupId);
    }

    @Transactional(readOnly = true)
    public Protocol getProtocol(AuthenticatedUser user, Long groupId, Long protocolId) {
        groupAccessService.requireAccess(user, groupId);
        return requireProtocol(groupId, protocolId);
    }

    @Transactional
    public Protocol createProtocol(AuthenticatedUser user, Long groupId, ProtocolRequest request) {
        groupService.getActiveGroup(groupId);
        groupAccessService.requireModerator(user, groupId);

        Protocol protocol = new Protocol();
        protocol.setGroupId(groupId);
        apply(protocol, request);
        if (request.getOrderIndex() == null) {
            protocol.setOrderIndex(protocolRepository.findByGroupIdOrderByOrderIndexAscCreatedAtAsc(groupId).size());
        }

        Protocol saved = protocolRepository.save(protocol);
        log.info("Created protocol {} in group {}", saved.getId(), groupId);
        return saved;
    }

    @Transactional
    public Protocol updateProtocol(AuthenticatedUser user, Long groupId, Long protocolId, ProtocolRequest request) {
        groupAccessService.requireModerator(user, groupId);
        Protocol protocol = requireProtocol(groupId, protocolId);
        apply(protocol, request);
        return protocolRepository.save(protocol);
    }

    @Transactional
    public void deleteProtocol(AuthenticatedUser user, Long groupId, Long protocolId) {
        groupAccessService.requireModerator(user, groupId);
        protocolRepository.delete(requireProtocol(groupId, protocolId));
        log.info("Deleted protocol {} in group {}", protocolId, groupId);
    }

    private void apply(Protocol protocol, ProtocolRequest request) {
        protocol.setTitle(request.getTitle().trim());
        protocol.setContent(request.getContent().trim());
        protocol.setImageUrl(request.getImageUrl());
        if (request.getOrderIndex() != null) {
            protocol.setOrderIndex(request.getOrderIndex());
        }
    }

    private Protocol requireProtocol(Long groupId, Long protocolId) {
        return protocolRepository.findByIdAndGroupId(protocolId, groupId)
                .orElseThrow(() -> new NotFoundException("Protocol not found"));
    }
}
